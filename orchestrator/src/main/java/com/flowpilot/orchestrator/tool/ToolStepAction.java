package com.flowpilot.orchestrator.tool;

import com.flowpilot.orchestrator.workflow.Context;
import com.flowpilot.orchestrator.workflow.StepAction;

/**
 * Step action for the {@code tool:<name>} DSL form: calls the tool with the
 * current context as parameters and returns its result.
 */
public class ToolStepAction implements StepAction {

    private final ToolRunner runner;
    private final String     toolName;

    public ToolStepAction(ToolRunner runner, String toolName) {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        this.runner   = runner;
        this.toolName = toolName;
    }

    public String toolName() { return toolName; }

    @Override
    public Object execute(Context context) {
        ToolResult result = runner.execute(toolName, context.snapshot());
        if (!result.ok()) {
            throw new ToolException(toolName, result.error());
        }
        return result.result();
    }
}
