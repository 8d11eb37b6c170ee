package com.flowpilot.orchestrator.workflow;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A step that runs its action only when the predicate over the context holds.
 * When it does not, the step completes with a null output and the run goes on.
 */
public class ConditionalStep extends Step {

    private final Predicate<Context> predicate;

    public ConditionalStep(String name, StepAction action, Predicate<Context> predicate) {
        this(name, action, predicate, null);
    }

    public ConditionalStep(String name, StepAction action, Predicate<Context> predicate, Duration timeout) {
        super(name, action, timeout);
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public StepType type() {
        return StepType.CONDITIONAL;
    }

    @Override
    protected Object invoke(Context context) throws Exception {
        if (!predicate.test(context)) {
            return null;
        }
        return super.invoke(context);
    }
}
