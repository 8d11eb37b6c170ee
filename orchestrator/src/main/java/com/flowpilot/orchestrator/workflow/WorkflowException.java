package com.flowpilot.orchestrator.workflow;

/**
 * A workflow run failed because one of its steps (or hooks) failed.
 *
 * Unchecked: local-mode callers either let it propagate or hand it to the
 * error classifier, which inspects the wrapped cause.
 */
public class WorkflowException extends RuntimeException {

    private final String stepName;

    public WorkflowException(String stepName, String message) {
        super(message);
        this.stepName = stepName;
    }

    public WorkflowException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    /** Name of the failing step, or null when a lifecycle hook failed. */
    public String getStepName() { return stepName; }
}
