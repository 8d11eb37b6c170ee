package com.flowpilot.orchestrator.workflow;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * The unit of work behind a {@link Step}.
 *
 * An action returns the step's output or throws; the engine turns either
 * outcome into a {@link StepResult} before any state transition is derived
 * from it.
 */
@FunctionalInterface
public interface StepAction {

    Object execute(Context context) throws Exception;

    /** Action that does nothing and produces a null output. */
    static StepAction noop() {
        return context -> null;
    }

    /** Action that always produces {@code value}. */
    static StepAction constant(Object value) {
        return context -> value;
    }

    /**
     * Adapter for a blocking call that does not need the context
     * (an HTTP request, a file read). Give the step a timeout if the call
     * can hang: timed steps run on the executor's pool and are interrupted
     * on expiry.
     */
    static StepAction blocking(Callable<?> call) {
        return context -> call.call();
    }

    /** Adapter for a side-effect-free computation. */
    static StepAction of(Supplier<?> supplier) {
        return context -> supplier.get();
    }
}
