package com.flowpilot.orchestrator.api.dto;

import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /jobs/{id}. Steps are listed in definition order.
 */
public record WorkflowRunResponse(
        String                   id,
        String                   name,
        WorkflowState            state,
        Map<String, Object>      context,
        Map<String, Object>      metadata,
        List<StepRecordResponse> steps,
        Instant                  createdAt,
        Instant                  updatedAt,
        String                   error
) {
    public static WorkflowRunResponse from(WorkflowRun run) {
        return new WorkflowRunResponse(
                run.id(),
                run.definition().name(),
                run.state(),
                run.context(),
                run.metadata(),
                run.steps().values().stream().map(StepRecordResponse::from).toList(),
                run.createdAt(),
                run.updatedAt(),
                run.error()
        );
    }
}
