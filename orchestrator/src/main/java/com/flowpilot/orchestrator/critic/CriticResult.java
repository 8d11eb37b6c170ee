package com.flowpilot.orchestrator.critic;

import java.util.List;

/**
 * A critic's verdict on one output.
 *
 * @param score   0.0 (unusable) to 1.0 (fine)
 * @param labels  short machine-readable tags, e.g. {@code complete}, {@code unsafe}
 * @param reasons human-readable explanations, one per finding
 */
public record CriticResult(double score, List<String> labels, List<String> reasons) {

    public CriticResult {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Critic score must be within [0, 1]: " + score);
        }
        labels  = labels == null ? List.of() : List.copyOf(labels);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static CriticResult of(double score, String label, String reason) {
        return new CriticResult(score, List.of(label), List.of(reason));
    }
}
