package com.flowpilot.orchestrator.service;

import java.util.Map;

/**
 * Result of {@link DistributedRunner#execute}.
 *
 * @param runId   store id for distributed runs; caller-supplied or {@code local-<uuid>} for local ones
 * @param failure first step failure, or null when every step succeeded
 * @param outputs final context of a local run; null for distributed runs, whose
 *                context lives in the checkpoint store
 */
public record Submission(String runId, Throwable failure, Map<String, Object> outputs) {

    public boolean failed() {
        return failure != null;
    }

    public boolean local() {
        return outputs != null;
    }
}
