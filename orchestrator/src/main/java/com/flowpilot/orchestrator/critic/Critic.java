package com.flowpilot.orchestrator.critic;

/**
 * Scores a step output. Implementations are stateless heuristics or model
 * calls; they must not throw for odd input, only score it low.
 */
public interface Critic {

    /** Registry key, referenced from {@code AgentPolicy.criticsToRun}. */
    String name();

    CriticResult evaluate(Object output);
}
