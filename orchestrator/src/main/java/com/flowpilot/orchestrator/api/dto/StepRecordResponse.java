package com.flowpilot.orchestrator.api.dto;

import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowState;

import java.time.Instant;

public record StepRecordResponse(
        String        name,
        WorkflowState state,
        Object        output,
        String        error,
        Instant       startedAt,
        Instant       finishedAt,
        int           retries
) {
    public static StepRecordResponse from(StepRecord s) {
        return new StepRecordResponse(
                s.name(),
                s.state(),
                s.output(),
                s.error(),
                s.startedAt(),
                s.finishedAt(),
                s.retries()
        );
    }
}
