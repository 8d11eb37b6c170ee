package com.flowpilot.orchestrator.history;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local history. Records are kept in arrival order; once
 * {@code capacity} is reached the oldest record is evicted for each new one.
 */
public class InMemoryHistoryStore implements HistoryStore {

    public static final String ERROR          = "ERROR";
    public static final String AGENT_DECISION = "AGENT_DECISION";

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int                 capacity;
    private final Deque<HistoryRecord> records = new ArrayDeque<>();
    private final ReentrantLock       lock     = new ReentrantLock();

    public InMemoryHistoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryHistoryStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public String recordWorkflowEvent(String workflowId, String eventType, Map<String, Object> payload) {
        Map<String, Object> body = payload != null ? payload : Map.of("workflow_id", workflowId);
        return append(eventType, "workflow", body, List.of("workflow", "workflow_id:" + workflowId));
    }

    @Override
    public String recordErrorEvent(String sourceId, String errorMessage, Map<String, Object> metadata) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source_id", sourceId);
        body.put("error", errorMessage);
        if (metadata != null) {
            body.putAll(metadata);
        }
        List<String> tags = new ArrayList<>(List.of("error"));
        if (metadata != null && metadata.get("tool") != null) {
            tags.add("tool:" + metadata.get("tool"));
        }
        return append(ERROR, "agent", body, tags);
    }

    @Override
    public String recordAgentDecision(String agentId, String decision, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agent_id", agentId);
        body.put("decision", decision);
        if (payload != null) {
            body.putAll(payload);
        }
        return append(AGENT_DECISION, "agent", body, List.of("agent"));
    }

    @Override
    public List<HistoryRecord> recentFailuresForTool(String toolName, int limit) {
        if (toolName == null || limit <= 0) {
            return List.of();
        }
        String tag = "tool:" + toolName;
        List<HistoryRecord> matches = new ArrayList<>();
        lock.lock();
        try {
            Iterator<HistoryRecord> newestFirst = records.descendingIterator();
            while (newestFirst.hasNext() && matches.size() < limit) {
                HistoryRecord record = newestFirst.next();
                if (ERROR.equals(record.type()) && record.tags().contains(tag)) {
                    matches.add(record);
                }
            }
        } finally {
            lock.unlock();
        }
        return matches;
    }

    /** Every record of the given type, oldest first. */
    public List<HistoryRecord> recordsOfType(String type) {
        lock.lock();
        try {
            return records.stream().filter(r -> r.type().equals(type)).toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    private String append(String type, String source, Map<String, Object> payload, List<String> tags) {
        String id = UUID.randomUUID().toString();
        HistoryRecord record = new HistoryRecord(id, type, source, payload, tags, Instant.now());
        lock.lock();
        try {
            if (records.size() == capacity) {
                records.removeFirst();
            }
            records.addLast(record);
        } finally {
            lock.unlock();
        }
        return id;
    }
}
