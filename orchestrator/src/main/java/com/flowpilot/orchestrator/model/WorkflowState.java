package com.flowpilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state shared by workflow runs and their steps.
 *
 * Transitions:
 *   PENDING   → RUNNING, FAILED, RETRYING
 *   RUNNING   → COMPLETED, FAILED, WAITING, RETRYING
 *   WAITING   → RUNNING, FAILED
 *   RETRYING  → RUNNING, FAILED
 *   FAILED    → RETRYING, FAILED
 *   COMPLETED → COMPLETED   (terminal; only the self-transition is accepted)
 */
public enum WorkflowState {
    PENDING,
    RUNNING,
    WAITING,
    RETRYING,
    FAILED,
    COMPLETED;

    private static final Map<WorkflowState, Set<WorkflowState>> ALLOWED = Map.of(
            PENDING,   EnumSet.of(RUNNING, FAILED, RETRYING),
            RUNNING,   EnumSet.of(COMPLETED, FAILED, WAITING, RETRYING),
            WAITING,   EnumSet.of(RUNNING, FAILED),
            RETRYING,  EnumSet.of(RUNNING, FAILED),
            FAILED,    EnumSet.of(RETRYING, FAILED),
            COMPLETED, EnumSet.of(COMPLETED)
    );

    public boolean canTransitionTo(WorkflowState next) {
        return ALLOWED.get(this).contains(next);
    }

    /**
     * @throws InvalidStateTransitionException if {@code next} is not reachable from this state
     */
    public void checkTransition(WorkflowState next) {
        if (!canTransitionTo(next)) {
            throw new InvalidStateTransitionException(this, next);
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
