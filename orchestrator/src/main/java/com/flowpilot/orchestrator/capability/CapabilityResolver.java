package com.flowpilot.orchestrator.capability;

import com.flowpilot.orchestrator.agent.AgentPolicy;

import java.util.List;
import java.util.Map;

/**
 * Maps a task description to tool-backed capabilities that can perform it.
 */
public interface CapabilityResolver {

    /** Matching tool capabilities, best first; empty when nothing fits. */
    List<Capability> findToolsForTask(String taskText, Map<String, Object> context, AgentPolicy policy);
}
