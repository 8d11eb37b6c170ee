package com.flowpilot.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered list of {@link Step}s with optional lifecycle hooks.
 *
 * {@link #run} is the local, in-process execution path: steps run strictly
 * in list order and each step sees the outputs of every step before it.
 * The distributed runner uses the same steps but dispatches them
 * concurrently.
 */
public class Workflow {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final String       name;
    private final List<Step>   steps;
    private final WorkflowHook beforeAll;
    private final WorkflowHook afterAll;
    private final WorkflowHook onError;

    private Workflow(Builder builder) {
        this.name      = builder.name;
        this.steps     = List.copyOf(builder.steps);
        this.beforeAll = builder.beforeAll;
        this.afterAll  = builder.afterAll;
        this.onError   = builder.onError;

        Set<String> seen = new HashSet<>();
        for (Step step : steps) {
            if (!seen.add(step.name())) {
                throw new WorkflowDefinitionException(
                        "Duplicate step name '" + step.name() + "' in workflow '" + name + "'");
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static Workflow of(String name, Step... steps) {
        return builder(name).steps(List.of(steps)).build();
    }

    public String     name()  { return name; }
    public List<Step> steps() { return steps; }

    public WorkflowDefinition toDefinition() {
        return new WorkflowDefinition(name, steps.stream().map(Step::toDefinition).toList());
    }

    // ------------------------------------------------------------------
    // Local execution
    // ------------------------------------------------------------------

    /**
     * Run every step in order on a short-lived executor.
     *
     * @throws WorkflowException naming the failing step, with the step's failure as cause
     */
    public Context run(Context context) {
        try (StepExecutor executor = new StepExecutor(1)) {
            return run(context, executor);
        }
    }

    /**
     * Run every step in order, writing each output into the context under
     * the step's name.
     *
     * On a step failure: records {@code error = {step, error}} in the context,
     * calls the on-error hook, then throws.
     *
     * @throws WorkflowException naming the failing step, with the step's failure as cause
     */
    public Context run(Context context, StepExecutor executor) {
        Context ctx = context != null ? context : new Context();

        callHook("beforeAll", beforeAll, ctx);

        for (Step step : steps) {
            StepResult result = executor.execute(step, ctx);
            ctx.recordDuration(step.name(), result.elapsed().toMillis());

            if (!result.succeeded()) {
                Throwable cause = result.failure();
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("step", step.name());
                error.put("error", message);
                ctx.put("error", error);

                WorkflowException failure = new WorkflowException(
                        step.name(), "Step '" + step.name() + "' failed: " + message, cause);
                try {
                    callHook("onError", onError, ctx);
                } catch (WorkflowException hookFailure) {
                    failure.addSuppressed(hookFailure);
                }
                log.warn("Workflow '{}' failed at step '{}': {}", name, step.name(), message);
                throw failure;
            }
            ctx.put(step.name(), result.output());
            log.debug("Step '{}' completed in {} ms", step.name(), result.elapsed().toMillis());
        }

        callHook("afterAll", afterAll, ctx);
        return ctx;
    }

    private static void callHook(String hookName, WorkflowHook hook, Context ctx) {
        if (hook == null) {
            return;
        }
        try {
            hook.apply(ctx);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowException(null, "Hook '" + hookName + "' interrupted", e);
        } catch (Exception e) {
            throw new WorkflowException(null, "Hook '" + hookName + "' failed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final String     name;
        private final List<Step> steps = new ArrayList<>();
        private WorkflowHook     beforeAll;
        private WorkflowHook     afterAll;
        private WorkflowHook     onError;

        private Builder(String name) {
            this.name = name == null || name.isBlank() ? "workflow" : name;
        }

        public Builder step(Step step)             { steps.add(step); return this; }
        public Builder steps(List<Step> more)      { steps.addAll(more); return this; }
        public Builder beforeAll(WorkflowHook h)   { this.beforeAll = h; return this; }
        public Builder afterAll(WorkflowHook h)    { this.afterAll = h; return this; }
        public Builder onError(WorkflowHook h)     { this.onError = h; return this; }

        public Workflow build() {
            return new Workflow(this);
        }
    }
}
