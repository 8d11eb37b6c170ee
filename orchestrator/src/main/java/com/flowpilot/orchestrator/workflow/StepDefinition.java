package com.flowpilot.orchestrator.workflow;

/**
 * Serialized form of one step inside a {@link WorkflowDefinition}.
 *
 * @param timeoutMillis null when the step has no timeout
 */
public record StepDefinition(String name, StepType type, Long timeoutMillis) {}
