package com.flowpilot.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of one step's checkpoint.
 * Only the checkpoint store creates these; callers never mutate a step directly.
 *
 * @param retries number of times the step entered RETRYING
 */
public record StepRecord(
        String              name,
        WorkflowState       state,
        Map<String, Object> input,
        Object              output,
        String              error,
        Instant             startedAt,
        Instant             finishedAt,
        int                 retries
) {
    public static StepRecord pending(String name) {
        return new StepRecord(name, WorkflowState.PENDING, null, null, null, null, null, 0);
    }
}
