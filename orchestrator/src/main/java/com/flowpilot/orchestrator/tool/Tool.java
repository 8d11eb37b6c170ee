package com.flowpilot.orchestrator.tool;

import java.util.Map;

/**
 * A named external capability the engine can invoke through {@link ToolRunner}.
 *
 * Adapters for concrete services live outside the engine; declaring an
 * implementation as a Spring bean is enough to make it routable.
 */
public interface Tool {

    /** Unique registry key, e.g. {@code trello_fetch_board}. */
    String name();

    /** Free text used by the keyword router to match tasks to tools. */
    String description();

    /**
     * @return the tool's result value
     * @throws Exception any failure; the registry records it and reports it
     *                   as a failed {@link ToolResult}
     */
    Object execute(Map<String, Object> params) throws Exception;
}
