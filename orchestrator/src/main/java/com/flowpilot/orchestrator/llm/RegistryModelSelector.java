package com.flowpilot.orchestrator.llm;

import com.flowpilot.orchestrator.agent.AgentPolicy;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Selects among a fixed list of configured models.
 *
 * Candidates are the enabled models the policy permits (allow list, deny
 * list, latency ceiling). Models carrying a preferred tag win when any
 * exist; ties are broken by cost, then latency.
 */
public class RegistryModelSelector implements ModelSelector {

    private static final int MAX_FALLBACKS = 2;

    private static final Comparator<ModelConfig> CHEAPEST_FIRST =
            Comparator.comparingDouble(ModelConfig::costHint)
                    .thenComparingDouble(ModelConfig::latencyHint);

    private final List<ModelConfig> models;

    public RegistryModelSelector(List<ModelConfig> models) {
        this.models = List.copyOf(models);
    }

    public List<ModelConfig> models() {
        return models;
    }

    @Override
    public Optional<String> selectModel(String taskType, AgentPolicy policy, Map<String, Object> context) {
        List<ModelConfig> candidates = permitted(policy);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (policy != null && !policy.preferredModelTags().isEmpty()) {
            Set<String> preferred = new HashSet<>(policy.preferredModelTags());
            List<ModelConfig> tagged = candidates.stream()
                    .filter(m -> m.tags().stream().anyMatch(preferred::contains))
                    .toList();
            if (!tagged.isEmpty()) {
                candidates = tagged;
            }
        }
        return candidates.stream().min(CHEAPEST_FIRST).map(ModelConfig::id);
    }

    @Override
    public List<String> selectFallbackModels(String taskType, AgentPolicy policy, Map<String, Object> context) {
        String primary = selectModel(taskType, policy, context).orElse(null);
        return permitted(policy).stream()
                .sorted(CHEAPEST_FIRST)
                .map(ModelConfig::id)
                .filter(id -> !id.equals(primary))
                .limit(MAX_FALLBACKS)
                .toList();
    }

    private List<ModelConfig> permitted(AgentPolicy policy) {
        return models.stream()
                .filter(ModelConfig::enabled)
                .filter(m -> policy == null || policy.allowedModels().isEmpty() || policy.allowedModels().contains(m.id()))
                .filter(m -> policy == null || !policy.forbiddenModels().contains(m.id()))
                .filter(m -> policy == null || policy.maxLatencyHint() == null || m.latencyHint() <= policy.maxLatencyHint())
                .toList();
    }
}
