package com.flowpilot.orchestrator.llm;

import com.flowpilot.orchestrator.agent.AgentPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryModelSelectorTest {

    private final RegistryModelSelector selector = new RegistryModelSelector(List.of(
            new ModelConfig("local-small", "simulated", List.of("fast"), 0.1, 0.1, true),
            new ModelConfig("local-large", "simulated", List.of("quality"), 0.4, 0.3, true),
            new ModelConfig("remote-premium", "simulated", List.of("quality", "long-context"), 1.0, 0.6, true),
            new ModelConfig("retired", "simulated", List.of("fast"), 0.0, 0.0, false)));

    private static AgentPolicy policy(List<String> allowed, List<String> preferredTags,
                                      List<String> forbidden, Double maxLatency) {
        return new AgentPolicy(1, 1, allowed, preferredTags, forbidden, maxLatency, false, null, null, null, null);
    }

    @Test
    void selectModel_noConstraints_cheapestEnabled() {
        assertThat(selector.selectModel("generic", AgentPolicy.defaults(), Map.of())).contains("local-small");
    }

    @Test
    void selectModel_preferredTag_winsOverCost() {
        AgentPolicy policy = policy(null, List.of("quality"), null, null);

        assertThat(selector.selectModel("generic", policy, Map.of())).contains("local-large");
    }

    @Test
    void selectModel_latencyCeilingAndDenyList() {
        AgentPolicy policy = policy(null, List.of("quality"), List.of("local-large"), 0.5);

        // remote-premium is too slow, local-large is forbidden: fall back to the untagged cheapest
        assertThat(selector.selectModel("generic", policy, Map.of())).contains("local-small");
    }

    @Test
    void selectModel_nothingPermitted_empty() {
        AgentPolicy policy = policy(List.of("retired"), null, null, null);

        assertThat(selector.selectModel("generic", policy, Map.of())).isEmpty();
    }

    @Test
    void selectFallbackModels_excludesPrimaryAndCapsAtTwo() {
        assertThat(selector.selectFallbackModels("generic", AgentPolicy.defaults(), Map.of()))
                .containsExactly("local-large", "remote-premium");
    }

    @Test
    void simulatedProvider_tagsOutputWithModel() {
        SimulatedModelProvider provider = new SimulatedModelProvider();

        assertThat(provider.generate("local-small", "hello")).isEqualTo("[local-small] hello");
        assertThatThrownBy(() -> provider.generate(" ", "hello")).isInstanceOf(ModelProviderException.class);
    }
}
