package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.model.WorkflowState;

/**
 * Bookkeeping rules shared by both store backends.
 */
final class Transitions {

    private Transitions() {}

    /**
     * Error text a run keeps after a transition. A run that is already
     * FAILED keeps its first error when another failure is reported, so the
     * step that actually broke the run stays visible.
     */
    static String runError(WorkflowState current, WorkflowState next, String existing, String reported) {
        if (current == WorkflowState.FAILED && next == WorkflowState.FAILED && existing != null) {
            return existing;
        }
        return reported;
    }
}
