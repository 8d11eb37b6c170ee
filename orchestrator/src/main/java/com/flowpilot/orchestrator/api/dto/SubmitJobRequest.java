package com.flowpilot.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * workflow is either a path (relative to the workflow directory) or an
 * inline definition object in the same shape as a workflow file.
 * Optional: context (initial values), deferred (leave the run to the
 * worker), maxParallel (per-run in-flight bound).
 */
public record SubmitJobRequest(JsonNode workflow, Map<String, Object> context,
                               Boolean deferred, Integer maxParallel) {

    public SubmitJobRequest {
        if (context == null) context = Map.of();
        if (deferred == null) deferred = Boolean.FALSE;
    }
}
