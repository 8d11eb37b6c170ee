package com.flowpilot.orchestrator.agent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Knobs for one self-correction session. Immutable; collections are copied
 * on construction.
 *
 * @param maxRetries             extra distributed submissions after a failed first run
 * @param maxCorrections         corrections after which {@link PolicyEngine#shouldEscalate} says stop
 * @param maxLatencyHint         models slower than this are never selected; null means no ceiling
 * @param escalationThresholds   e.g. {@code tool_failures: 3}
 * @param criticsToRun           critic registry names evaluated by the agent loop
 */
public record AgentPolicy(
        int                  maxRetries,
        int                  maxCorrections,
        List<String>         allowedModels,
        List<String>         preferredModelTags,
        List<String>         forbiddenModels,
        Double               maxLatencyHint,
        boolean              useEnsembleForCriticalTasks,
        List<String>         preferredCapabilityTags,
        List<String>         preferredTools,
        Map<String, Integer> escalationThresholds,
        List<String>         criticsToRun
) {
    public static final String TOOL_FAILURES = "tool_failures";

    static final int DEFAULT_TOOL_FAILURE_THRESHOLD = 3;

    public AgentPolicy {
        if (maxRetries < 0 || maxCorrections < 0) {
            throw new IllegalArgumentException("maxRetries and maxCorrections must not be negative");
        }
        allowedModels           = copy(allowedModels);
        preferredModelTags      = copy(preferredModelTags);
        forbiddenModels         = copy(forbiddenModels);
        preferredCapabilityTags = copy(preferredCapabilityTags);
        preferredTools          = copy(preferredTools);
        criticsToRun            = copy(criticsToRun);
        escalationThresholds    = escalationThresholds == null ? Map.of() : Map.copyOf(escalationThresholds);
    }

    public static AgentPolicy defaults() {
        return new AgentPolicy(1, 1, null, null, null, null, false, null, null, null, null);
    }

    public int toolFailureThreshold() {
        return escalationThresholds.getOrDefault(TOOL_FAILURES, DEFAULT_TOOL_FAILURE_THRESHOLD);
    }

    public AgentPolicy withMaxRetries(int retries) {
        return new AgentPolicy(retries, maxCorrections, allowedModels, preferredModelTags, forbiddenModels,
                maxLatencyHint, useEnsembleForCriticalTasks, preferredCapabilityTags, preferredTools,
                escalationThresholds, criticsToRun);
    }

    public AgentPolicy withCriticsToRun(List<String> critics) {
        return new AgentPolicy(maxRetries, maxCorrections, allowedModels, preferredModelTags, forbiddenModels,
                maxLatencyHint, useEnsembleForCriticalTasks, preferredCapabilityTags, preferredTools,
                escalationThresholds, critics);
    }

    public AgentPolicy withEnsembleForCriticalTasks(boolean enabled) {
        return new AgentPolicy(maxRetries, maxCorrections, allowedModels, preferredModelTags, forbiddenModels,
                maxLatencyHint, enabled, preferredCapabilityTags, preferredTools,
                escalationThresholds, criticsToRun);
    }

    public AgentPolicy withEscalationThreshold(String key, int value) {
        Map<String, Integer> thresholds = new HashMap<>(escalationThresholds);
        thresholds.put(key, value);
        return new AgentPolicy(maxRetries, maxCorrections, allowedModels, preferredModelTags, forbiddenModels,
                maxLatencyHint, useEnsembleForCriticalTasks, preferredCapabilityTags, preferredTools,
                thresholds, criticsToRun);
    }

    private static List<String> copy(List<String> source) {
        return source == null ? List.of() : List.copyOf(source);
    }
}
