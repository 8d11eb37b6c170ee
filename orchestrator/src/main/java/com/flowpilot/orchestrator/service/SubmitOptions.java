package com.flowpilot.orchestrator.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-submission knobs.
 *
 * @param deferred    create the run and return without dispatching; the worker advances it
 * @param maxParallel in-flight step bound for this run; null uses the runner default
 */
public record SubmitOptions(boolean deferred, Integer maxParallel) {

    public SubmitOptions {
        if (maxParallel != null && maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1: " + maxParallel);
        }
    }

    public static SubmitOptions defaults() {
        return new SubmitOptions(false, null);
    }

    public static SubmitOptions deferredRun() {
        return new SubmitOptions(true, null);
    }

    /** Form stored in the run's metadata. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("deferred", deferred);
        if (maxParallel != null) {
            map.put("max_parallel", maxParallel);
        }
        return map;
    }

    /** Whether run metadata written by {@link #toMap()} marks the run as deferred. */
    static boolean isDeferred(Map<String, Object> metadata) {
        return metadata != null
                && metadata.get("options") instanceof Map<?, ?> options
                && Boolean.TRUE.equals(options.get("deferred"));
    }
}
