package com.flowpilot.orchestrator.agent;

import com.flowpilot.orchestrator.model.WorkflowRun;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one self-correction session.
 *
 * {@code workflowId} starts as the first run's id and follows each retry;
 * {@code metadata} carries hints for the strategies (tool, task_type,
 * critical, last_query) and accumulates their context updates.
 */
public class LoopContext {

    private final String              originalRunId;
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private volatile String           workflowId;
    private volatile int              attempts;
    private volatile WorkflowRun      lastResult;

    public LoopContext(String workflowId, Map<String, Object> metadata) {
        this.originalRunId = workflowId;
        this.workflowId    = workflowId;
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) {
                    this.metadata.put(k, v);
                }
            });
        }
    }

    public String originalRunId()          { return originalRunId; }
    public String workflowId()             { return workflowId; }
    public int attempts()                  { return attempts; }
    public WorkflowRun lastResult()        { return lastResult; }
    public Map<String, Object> metadata()  { return metadata; }

    public int incrementAttempts()               { return ++attempts; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }
    public void setLastResult(WorkflowRun run)   { this.lastResult = run; }

    /** Merge strategy output into the hints; null values remove the key. */
    public void mergeMetadata(Map<String, Object> updates) {
        if (updates == null) return;
        updates.forEach((k, v) -> {
            if (v == null) metadata.remove(k);
            else metadata.put(k, v);
        });
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
