package com.flowpilot.orchestrator.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable key/value state shared by the steps of one run.
 *
 * A completed step writes its output under its own name; later steps (and
 * the caller, once the run is over) read it back. Every key has exactly one
 * writer, so the only thing this class guards against is concurrent access
 * to the backing map when steps run in parallel.
 *
 * Null values are allowed: a conditional step whose predicate is false
 * records a null output under its name.
 */
public class Context {

    private final Map<String, Object> data = Collections.synchronizedMap(new LinkedHashMap<>());

    // Per-step wall-clock durations, kept apart from the values so that
    // callers comparing the context contents only see step outputs.
    private final Map<String, Long> durationsMs = Collections.synchronizedMap(new LinkedHashMap<>());

    public Context() {}

    public Context(Map<String, ?> initial) {
        if (initial != null) {
            data.putAll(initial);
        }
    }

    public Object get(String key) {
        return data.get(key);
    }

    public Object get(String key, Object defaultValue) {
        synchronized (data) {
            return data.containsKey(key) ? data.get(key) : defaultValue;
        }
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public void put(String key, Object value) {
        data.put(key, value);
    }

    void recordDuration(String stepName, long millis) {
        durationsMs.put(stepName, millis);
    }

    /** Step name to duration in milliseconds, for steps run through {@link Workflow#run}. */
    public Map<String, Long> durations() {
        synchronized (durationsMs) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(durationsMs));
        }
    }

    /** Point-in-time copy of every key and value. */
    public Map<String, Object> snapshot() {
        synchronized (data) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    @Override
    public String toString() {
        return "Context" + snapshot();
    }
}
