package com.flowpilot.orchestrator.capability;

import java.util.List;

/**
 * Catalog entry describing something the platform can do.
 *
 * @param toolName registry key of the tool that provides it, or null when
 *                 the capability is not backed by a tool
 */
public record Capability(
        String       id,
        String       name,
        String       description,
        List<String> tags,
        String       toolName
) {
    public Capability {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean isTool() {
        return toolName != null && !toolName.isBlank();
    }
}
