package com.flowpilot.orchestrator.llm;

/**
 * Deterministic stand-in that echoes the prompt tagged with the model id.
 * Used when no real provider is configured.
 */
public class SimulatedModelProvider implements ModelProvider {

    @Override
    public String generate(String modelId, String prompt) {
        if (modelId == null || modelId.isBlank()) {
            throw new ModelProviderException("Model id must not be blank");
        }
        return "[" + modelId + "] " + (prompt == null ? "" : prompt);
    }
}
