package com.flowpilot.orchestrator.history;

import java.util.List;
import java.util.Map;

/**
 * Append-only memory of workflow events, errors and agent decisions.
 *
 * The policy engine reads it to notice tools that keep failing; the runner
 * and the agent loop write to it. Every method returns the new record id.
 */
public interface HistoryStore {

    String recordWorkflowEvent(String workflowId, String eventType, Map<String, Object> payload);

    /**
     * A {@code tool} entry in {@code metadata} tags the record
     * {@code tool:<name>} so {@link #recentFailuresForTool} can find it.
     */
    String recordErrorEvent(String sourceId, String errorMessage, Map<String, Object> metadata);

    String recordAgentDecision(String agentId, String decision, Map<String, Object> payload);

    /** Most recent error records tagged with the tool, newest first, at most {@code limit}. */
    List<HistoryRecord> recentFailuresForTool(String toolName, int limit);
}
