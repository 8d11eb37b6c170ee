package com.flowpilot.orchestrator.capability;

import com.flowpilot.orchestrator.agent.AgentPolicy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves tasks against a static capability catalog.
 *
 * A capability matches when its name occurs in the task text, when any task
 * word occurs in its description, or when it carries one of the policy's
 * preferred capability tags. Tag matches rank above text-only matches.
 */
public class CatalogCapabilityResolver implements CapabilityResolver {

    private final List<Capability> catalog;

    public CatalogCapabilityResolver(List<Capability> catalog) {
        this.catalog = List.copyOf(catalog);
    }

    @Override
    public List<Capability> findToolsForTask(String taskText, Map<String, Object> context, AgentPolicy policy) {
        String task = taskText == null ? "" : taskText.toLowerCase(Locale.ROOT);
        String[] words = task.split("[^a-z0-9]+");
        Set<String> preferredTags = policy == null ? Set.of() : new HashSet<>(policy.preferredCapabilityTags());

        List<Scored> matches = new ArrayList<>();
        for (Capability cap : catalog) {
            if (!cap.isTool()) continue;

            boolean tagMatch = cap.tags().stream().anyMatch(preferredTags::contains);
            boolean textMatch = (!task.isBlank() && task.contains(cap.name().toLowerCase(Locale.ROOT)))
                    || mentionsAny(cap.description(), words);
            if (tagMatch || textMatch) {
                matches.add(new Scored(cap, (tagMatch ? 2 : 0) + (textMatch ? 1 : 0)));
            }
        }
        return matches.stream()
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .map(Scored::capability)
                .toList();
    }

    private static boolean mentionsAny(String description, String[] words) {
        if (description == null) return false;
        String desc = description.toLowerCase(Locale.ROOT);
        for (String word : words) {
            if (word.length() > 2 && desc.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private record Scored(Capability capability, int score) {}
}
