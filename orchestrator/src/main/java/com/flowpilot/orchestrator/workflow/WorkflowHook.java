package com.flowpilot.orchestrator.workflow;

/**
 * Callback run around a workflow: before the first step, after the last one,
 * or when a step fails.
 */
@FunctionalInterface
public interface WorkflowHook {

    void apply(Context context) throws Exception;
}
