package com.flowpilot.orchestrator.llm;

/**
 * Text generation behind a model id. Real providers are plugged in by the
 * deployment; the engine only needs this one call.
 */
@FunctionalInterface
public interface ModelProvider {

    /**
     * @throws ModelProviderException when the model cannot produce a response
     */
    String generate(String modelId, String prompt);
}
