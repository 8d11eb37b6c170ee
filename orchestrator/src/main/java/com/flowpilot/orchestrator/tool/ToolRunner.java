package com.flowpilot.orchestrator.tool;

import java.util.Map;

/**
 * The one contract through which workflow steps reach external tools.
 */
@FunctionalInterface
public interface ToolRunner {

    /**
     * @throws ToolNotFoundException if no tool is registered under {@code name}
     */
    ToolResult execute(String name, Map<String, Object> params);
}
