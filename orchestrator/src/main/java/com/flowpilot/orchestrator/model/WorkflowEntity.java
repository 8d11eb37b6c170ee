package com.flowpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable row for one workflow run.
 *
 * definition / context / metadata are JSON blobs written by the checkpoint
 * store; this class never interprets them.
 *
 * DB table: workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflows")
public class WorkflowEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowState state = WorkflowState.PENDING;

    @Column(nullable = false)
    private String definition;

    @Column(nullable = false)
    private String context;

    @Column(nullable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private String error;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowEntity() {}   // required by JPA

    public WorkflowEntity(String id, String definition, String context, String metadata, Instant now) {
        this.id         = id;
        this.definition = definition;
        this.context    = context;
        this.metadata   = metadata;
        this.createdAt  = now;
        this.updatedAt  = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String        getId()         { return id; }
    public WorkflowState getState()      { return state; }
    public String        getDefinition() { return definition; }
    public String        getContext()    { return context; }
    public String        getMetadata()   { return metadata; }
    public Instant       getCreatedAt()  { return createdAt; }
    public Instant       getUpdatedAt()  { return updatedAt; }
    public String        getError()      { return error; }

    public void setState(WorkflowState state)  { this.state = state; }
    public void setContext(String context)     { this.context = context; }
    public void setUpdatedAt(Instant t)        { this.updatedAt = t; }
    public void setError(String error)         { this.error = error; }
}
