package com.flowpilot.orchestrator.capability;

import com.flowpilot.orchestrator.agent.AgentPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogCapabilityResolverTest {

    private final CatalogCapabilityResolver resolver = new CatalogCapabilityResolver(List.of(
            new Capability("c1", "search", "Search the web for documents", List.of("web"), "web_search"),
            new Capability("c2", "boards", "Fetch cards from a kanban board", List.of("kanban"), "trello_fetch_board"),
            new Capability("c3", "review", "Manual review by a person", List.of("human"), null)));

    private static AgentPolicy preferring(String... tags) {
        return new AgentPolicy(1, 1, null, null, null, null, false, List.of(tags), null, null, null);
    }

    @Test
    void findToolsForTask_textMatchOnDescription() {
        assertThat(resolver.findToolsForTask("fetch my board", Map.of(), AgentPolicy.defaults()))
                .extracting(Capability::toolName)
                .containsExactly("trello_fetch_board");
    }

    @Test
    void findToolsForTask_tagMatchRanksFirst() {
        assertThat(resolver.findToolsForTask("search for kanban cards", Map.of(), preferring("kanban")))
                .extracting(Capability::toolName)
                .containsExactly("trello_fetch_board", "web_search");
    }

    @Test
    void findToolsForTask_skipsCapabilitiesWithoutTool() {
        assertThat(resolver.findToolsForTask("manual review", Map.of(), preferring("human"))).isEmpty();
    }
}
