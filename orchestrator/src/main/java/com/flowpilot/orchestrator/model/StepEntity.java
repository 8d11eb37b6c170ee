package com.flowpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable checkpoint of one step within a run.
 *
 * position keeps the definition order so snapshots list steps the way the
 * workflow declared them.
 *
 * DB table: steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "steps")
public class StepEntity {

    @EmbeddedId
    private StepKey id;

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowState state = WorkflowState.PENDING;

    // JSON blobs; null until the step produces them.
    private String input;
    private String output;

    private String error;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(nullable = false)
    private int retries = 0;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepEntity() {}   // required by JPA

    public StepEntity(String workflowId, String name, int position) {
        this.id       = new StepKey(workflowId, name);
        this.position = position;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public StepKey       getId()         { return id; }
    public String        getName()       { return id.getName(); }
    public int           getPosition()   { return position; }
    public WorkflowState getState()      { return state; }
    public String        getInput()      { return input; }
    public String        getOutput()     { return output; }
    public String        getError()      { return error; }
    public Instant       getStartedAt()  { return startedAt; }
    public Instant       getFinishedAt() { return finishedAt; }
    public int           getRetries()    { return retries; }

    public void setState(WorkflowState state) { this.state = state; }
    public void setOutput(String output)      { this.output = output; }
    public void setError(String error)        { this.error = error; }
    public void setStartedAt(Instant t)       { this.startedAt = t; }
    public void setFinishedAt(Instant t)      { this.finishedAt = t; }
    public void incrementRetries()            { this.retries++; }
}
