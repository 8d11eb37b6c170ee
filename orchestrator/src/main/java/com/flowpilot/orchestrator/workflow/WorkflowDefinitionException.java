package com.flowpilot.orchestrator.workflow;

/**
 * A workflow could not be built from its definition (unknown action,
 * duplicate step name, unreadable file). Raised at submission time;
 * nothing is stored for a definition that fails here.
 */
public class WorkflowDefinitionException extends RuntimeException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
