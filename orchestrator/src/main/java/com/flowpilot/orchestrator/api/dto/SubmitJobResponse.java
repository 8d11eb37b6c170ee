package com.flowpilot.orchestrator.api.dto;

import com.flowpilot.orchestrator.model.WorkflowState;

/**
 * Response body for POST /jobs: the run id to poll and the state the run
 * was in when the request returned.
 */
public record SubmitJobResponse(String id, WorkflowState state) {}
