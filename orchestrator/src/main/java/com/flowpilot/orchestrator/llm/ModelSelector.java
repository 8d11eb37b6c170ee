package com.flowpilot.orchestrator.llm;

import com.flowpilot.orchestrator.agent.AgentPolicy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses which model a task should run on under a given policy.
 */
public interface ModelSelector {

    Optional<String> selectModel(String taskType, AgentPolicy policy, Map<String, Object> context);

    /** Alternatives to {@link #selectModel}'s choice, best first. At most two. */
    List<String> selectFallbackModels(String taskType, AgentPolicy policy, Map<String, Object> context);
}
