package com.flowpilot.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite primary key of the steps table: (workflow_id, name).
 */
@Embeddable
public class StepKey implements Serializable {

    @Column(name = "workflow_id", length = 64, nullable = false)
    private String workflowId;

    @Column(nullable = false)
    private String name;

    protected StepKey() {}   // required by JPA

    public StepKey(String workflowId, String name) {
        this.workflowId = workflowId;
        this.name       = name;
    }

    public String getWorkflowId() { return workflowId; }
    public String getName()       { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepKey other)) return false;
        return workflowId.equals(other.workflowId) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, name);
    }
}
