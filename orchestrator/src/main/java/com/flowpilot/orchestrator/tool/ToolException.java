package com.flowpilot.orchestrator.tool;

/**
 * A tool ran but reported failure.
 *
 * Unchecked so it travels through step actions unchanged and reaches the
 * error classifier with the tool name attached.
 */
public class ToolException extends RuntimeException {

    private final String toolName;

    public ToolException(String toolName, String message) {
        super("Tool '" + toolName + "' failed: " + message);
        this.toolName = toolName;
    }

    public String getToolName() { return toolName; }
}
