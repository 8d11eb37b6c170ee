package com.flowpilot.orchestrator.critic;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cheap plausibility check: catches doubled negations and empty answers,
 * treats everything else as plausible.
 */
@Component
public class FactualityCritic implements Critic {

    private static final List<String> CONTRADICTIONS = List.of("not not", "cannot cannot");

    @Override public String name() { return "factuality"; }

    @Override
    public CriticResult evaluate(Object output) {
        String text = output == null ? "" : output.toString();
        if (CONTRADICTIONS.stream().anyMatch(text::contains)) {
            return CriticResult.of(0.2, "contradiction", "self-contradiction detected");
        }
        if (!text.isEmpty()) {
            return CriticResult.of(0.8, "plausible", "basic plausibility (heuristic)");
        }
        return CriticResult.of(0.0, "missing", "no content");
    }
}
