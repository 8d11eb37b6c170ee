package com.flowpilot.orchestrator.model;

import com.flowpilot.orchestrator.workflow.WorkflowDefinition;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of a checkpointed workflow run.
 *
 * Steps are keyed by name in definition order. Context and metadata may hold
 * null values (a skipped conditional step records null), so they are copied
 * into unmodifiable linked maps rather than {@link Map#copyOf}.
 */
public record WorkflowRun(
        String                  id,
        WorkflowDefinition      definition,
        Map<String, Object>     context,
        Map<String, Object>     metadata,
        WorkflowState           state,
        Map<String, StepRecord> steps,
        Instant                 createdAt,
        Instant                 updatedAt,
        String                  error
) {
    public WorkflowRun {
        context  = frozen(context);
        metadata = frozen(metadata);
        steps    = frozen(steps);
    }

    public StepRecord step(String name) {
        StepRecord step = steps.get(name);
        if (step == null) {
            throw new RunNotFoundException(id, name);
        }
        return step;
    }

    public boolean allStepsCompleted() {
        return steps.values().stream().allMatch(s -> s.state() == WorkflowState.COMPLETED);
    }

    private static <V> Map<String, V> frozen(Map<String, V> source) {
        return source == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
