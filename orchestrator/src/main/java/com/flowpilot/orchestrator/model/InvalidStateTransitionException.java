package com.flowpilot.orchestrator.model;

/**
 * Rejected state change. Always a programming error on the caller's side;
 * the store leaves the record untouched when it throws this.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final WorkflowState from;
    private final WorkflowState to;

    public InvalidStateTransitionException(WorkflowState from, WorkflowState to) {
        super("Cannot transition from " + from + " to " + to);
        this.from = from;
        this.to   = to;
    }

    public WorkflowState getFrom() { return from; }
    public WorkflowState getTo()   { return to; }
}
