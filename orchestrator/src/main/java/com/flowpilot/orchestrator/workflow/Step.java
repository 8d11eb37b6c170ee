package com.flowpilot.orchestrator.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * One named unit of work in a {@link Workflow}.
 *
 * Subclasses change how the action is selected ({@link ConditionalStep},
 * {@link BranchStep}); timing and failure capture live in {@link StepExecutor}.
 */
public class Step {

    private final String     name;
    private final StepAction action;
    private final Duration   timeout;

    public Step(String name, StepAction action) {
        this(name, action, null);
    }

    public Step(String name, StepAction action, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new WorkflowDefinitionException("Step name must not be blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new WorkflowDefinitionException("Step '" + name + "' has a non-positive timeout: " + timeout);
        }
        this.name    = name;
        this.action  = Objects.requireNonNull(action, "action");
        this.timeout = timeout;
    }

    public String   name()    { return name; }
    public Duration timeout() { return timeout; }

    public StepType type() {
        return StepType.TASK;
    }

    /** Run the step body on the calling thread. */
    protected Object invoke(Context context) throws Exception {
        return action.execute(context);
    }

    StepDefinition toDefinition() {
        return new StepDefinition(name, type(), timeout == null ? null : timeout.toMillis());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
