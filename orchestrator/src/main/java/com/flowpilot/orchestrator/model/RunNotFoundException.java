package com.flowpilot.orchestrator.model;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Workflow run not found: " + runId);
    }

    public RunNotFoundException(String runId, String stepName) {
        super("Step '" + stepName + "' not found in workflow run " + runId);
    }
}
