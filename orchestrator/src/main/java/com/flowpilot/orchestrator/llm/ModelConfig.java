package com.flowpilot.orchestrator.llm;

import java.util.List;

/**
 * One registered model and the hints the selector ranks it by.
 *
 * @param costHint    relative cost; lower is cheaper
 * @param latencyHint relative latency; lower is faster
 */
public record ModelConfig(
        String       id,
        String       provider,
        List<String> tags,
        double       costHint,
        double       latencyHint,
        boolean      enabled
) {
    public ModelConfig {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
