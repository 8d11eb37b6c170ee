package com.flowpilot.orchestrator.workflow;

import java.time.Duration;

/**
 * Outcome of one step execution: either an output or the failure that
 * prevented it. Callers branch on {@link #succeeded()} instead of catching.
 */
public record StepResult(Object output, Throwable failure, Duration elapsed) {

    public static StepResult success(Object output, Duration elapsed) {
        return new StepResult(output, null, elapsed);
    }

    public static StepResult failure(Throwable failure, Duration elapsed) {
        return new StepResult(null, failure, elapsed);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public boolean timedOut() {
        return failure instanceof StepTimeoutException;
    }
}
