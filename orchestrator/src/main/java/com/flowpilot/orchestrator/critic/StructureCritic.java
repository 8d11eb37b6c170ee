package com.flowpilot.orchestrator.critic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that a map output carries the required keys. Each missing key costs
 * 0.25; a non-map output misses all of them.
 */
public class StructureCritic implements Critic {

    private final List<String> requiredKeys;

    public StructureCritic(List<String> requiredKeys) {
        this.requiredKeys = requiredKeys == null ? List.of() : List.copyOf(requiredKeys);
    }

    @Override public String name() { return "structure"; }

    @Override
    public CriticResult evaluate(Object output) {
        List<String> missing = new ArrayList<>();
        String label;
        if (output instanceof Map<?, ?> map) {
            label = "dict";
            for (String key : requiredKeys) {
                if (!map.containsKey(key)) {
                    missing.add(key);
                }
            }
        } else {
            label = "non-dict";
            missing.addAll(requiredKeys);
        }
        if (missing.isEmpty()) {
            return CriticResult.of(1.0, label, "structure ok");
        }
        return CriticResult.of(Math.max(0.0, 1.0 - missing.size() * 0.25), label,
                "missing: " + String.join(", ", missing));
    }
}
