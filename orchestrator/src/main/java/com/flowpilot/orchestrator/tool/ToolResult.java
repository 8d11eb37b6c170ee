package com.flowpilot.orchestrator.tool;

/**
 * Outcome of a tool call: a result when {@code ok}, an error message otherwise.
 */
public record ToolResult(boolean ok, Object result, String error) {

    public static ToolResult ok(Object result) {
        return new ToolResult(true, result, null);
    }

    public static ToolResult error(String error) {
        return new ToolResult(false, null, error);
    }
}
