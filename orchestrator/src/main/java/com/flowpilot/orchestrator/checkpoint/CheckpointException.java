package com.flowpilot.orchestrator.checkpoint;

/**
 * The checkpoint store could not encode or decode a stored value.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
