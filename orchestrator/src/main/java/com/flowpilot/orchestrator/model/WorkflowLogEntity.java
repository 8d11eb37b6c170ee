package com.flowpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One audit line for a run. Best-effort and never read by the engine itself.
 *
 * DB table: workflow_logs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_logs")
public class WorkflowLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", length = 64, nullable = false)
    private String workflowId;

    @Column(nullable = false)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    protected WorkflowLogEntity() {}   // required by JPA

    public WorkflowLogEntity(String workflowId, String message) {
        this.workflowId = workflowId;
        this.message    = message;
    }

    public Long    getId()         { return id; }
    public String  getWorkflowId() { return workflowId; }
    public String  getMessage()    { return message; }
    public Instant getCreatedAt()  { return createdAt; }
}
