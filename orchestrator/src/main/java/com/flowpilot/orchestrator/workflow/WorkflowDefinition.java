package com.flowpilot.orchestrator.workflow;

import java.util.List;

/**
 * Serializable description of a workflow, stored with every checkpointed run.
 * Actions are code and are not part of it.
 */
public record WorkflowDefinition(String name, List<StepDefinition> steps) {

    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public List<String> stepNames() {
        return steps.stream().map(StepDefinition::name).toList();
    }
}
