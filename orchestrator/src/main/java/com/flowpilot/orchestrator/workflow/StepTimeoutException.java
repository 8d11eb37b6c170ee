package com.flowpilot.orchestrator.workflow;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Raised when a step exceeds its configured timeout and is cancelled.
 */
public class StepTimeoutException extends TimeoutException {

    private final String   stepName;
    private final Duration timeout;

    public StepTimeoutException(String stepName, Duration timeout) {
        super("Step '" + stepName + "' timed out after " + timeout.toMillis() + " ms");
        this.stepName = stepName;
        this.timeout  = timeout;
    }

    public String   getStepName() { return stepName; }
    public Duration getTimeout()  { return timeout; }
}
