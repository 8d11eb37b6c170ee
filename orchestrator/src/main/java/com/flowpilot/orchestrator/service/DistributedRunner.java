package com.flowpilot.orchestrator.service;

import com.flowpilot.orchestrator.checkpoint.CheckpointStore;
import com.flowpilot.orchestrator.history.HistoryStore;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.tool.ToolException;
import com.flowpilot.orchestrator.workflow.Context;
import com.flowpilot.orchestrator.workflow.Step;
import com.flowpilot.orchestrator.workflow.StepExecutor;
import com.flowpilot.orchestrator.workflow.StepResult;
import com.flowpilot.orchestrator.workflow.Workflow;
import com.flowpilot.orchestrator.workflow.WorkflowException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Submits workflows either in-process or as checkpointed distributed runs.
 *
 * <p>Distributed runs dispatch every step at once onto the dispatch pool,
 * gated by a fair semaphore so at most {@code maxParallel} steps of one run
 * are in flight. Steps are treated as independent: each sees the initial
 * context plus whatever siblings have already published.
 *
 * <p>Sibling failure: the first failing step marks the run FAILED. Steps
 * still waiting for a permit are not started and are recorded as FAILED
 * with {@code cancelled: sibling step '<name>' failed}; steps already
 * running finish and record their own outcome.
 *
 * <p>All state changes go through the {@link CheckpointStore}. A distributed
 * submission never throws for a step failure; the outcome is read back from
 * the store.
 */
public class DistributedRunner {

    private static final Logger log = LoggerFactory.getLogger(DistributedRunner.class);

    static final String OUTCOME_METRIC = "flowpilot.step.outcomes";

    private final CheckpointStore store;
    private final StepExecutor    stepExecutor;
    private final ExecutorService dispatchPool;
    private final int             maxParallel;
    private final HistoryStore    history;        // nullable
    private final MeterRegistry   meterRegistry;

    public DistributedRunner(CheckpointStore store,
                             StepExecutor stepExecutor,
                             ExecutorService dispatchPool,
                             int maxParallel,
                             HistoryStore history,
                             MeterRegistry meterRegistry) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1: " + maxParallel);
        }
        this.store         = store;
        this.stepExecutor  = stepExecutor;
        this.dispatchPool  = dispatchPool;
        this.maxParallel   = maxParallel;
        this.history       = history;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * @return the run id
     * @throws WorkflowException in local mode, when a step or hook fails
     */
    public String submit(Workflow workflow, Map<String, Object> initialContext,
                         SubmitOptions options, boolean distributed) {
        Submission submission = execute(workflow, initialContext, options, distributed);
        if (!distributed && submission.failure() instanceof WorkflowException e) {
            throw e;
        }
        return submission.runId();
    }

    /**
     * Like {@link #submit} but never throws for step failures in either mode;
     * the first failure is returned alongside the run id.
     */
    public Submission execute(Workflow workflow, Map<String, Object> initialContext,
                              SubmitOptions options, boolean distributed) {
        Map<String, Object> initial = initialContext == null ? Map.of() : initialContext;
        SubmitOptions opts = options == null ? SubmitOptions.defaults() : options;
        return distributed
                ? runDistributed(workflow, initial, opts)
                : runLocal(workflow, initial);
    }

    public WorkflowRun getRun(String runId) {
        return store.getWorkflowState(runId);
    }

    public List<String> getLogs(String runId) {
        return store.getLogs(runId);
    }

    public CheckpointStore store() {
        return store;
    }

    // ------------------------------------------------------------------
    // Local mode
    // ------------------------------------------------------------------

    private Submission runLocal(Workflow workflow, Map<String, Object> initialContext) {
        Object requestedId = initialContext.get("workflow_id");
        String runId = requestedId != null ? requestedId.toString() : "local-" + UUID.randomUUID();
        Context ctx = new Context(initialContext);

        MDC.put("runId", runId);
        try {
            workflow.run(ctx, stepExecutor);
            log.info("Local run of '{}' completed", workflow.name());
            return new Submission(runId, null, ctx.snapshot());
        } catch (WorkflowException e) {
            log.warn("Local run of '{}' failed: {}", workflow.name(), e.getMessage());
            return new Submission(runId, e, ctx.snapshot());
        } finally {
            MDC.remove("runId");
        }
    }

    // ------------------------------------------------------------------
    // Distributed mode
    // ------------------------------------------------------------------

    private Submission runDistributed(Workflow workflow, Map<String, Object> initialContext, SubmitOptions options) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("options", options.toMap());
        String runId = store.createWorkflowRun(workflow.toDefinition(), initialContext, metadata);

        if (options.deferred()) {
            log.info("Run {} of '{}' created for deferred execution", runId, workflow.name());
            return new Submission(runId, null, null);
        }

        store.updateWorkflowState(runId, WorkflowState.RUNNING, null);
        recordEvent(runId, "WORKFLOW_START", Map.of("workflow_id", runId, "name", workflow.name()));
        log.info("Run {} of '{}' started: {} steps", runId, workflow.name(), workflow.steps().size());

        int permits = options.maxParallel() != null ? options.maxParallel() : maxParallel;
        Semaphore gate = new Semaphore(permits, true);
        AtomicReference<WorkflowException> firstFailure = new AtomicReference<>();
        Context ctx = new Context(initialContext);
        List<CompletableFuture<Void>> inflight = new ArrayList<>();

        for (Step step : workflow.steps()) {
            if (firstFailure.get() != null) {
                skip(runId, step, firstFailure.get());
                continue;
            }
            try {
                gate.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(runId, step, e, firstFailure);
                continue;
            }
            // Re-check: a sibling may have failed while this step waited for a permit.
            if (firstFailure.get() != null) {
                gate.release();
                skip(runId, step, firstFailure.get());
                continue;
            }
            try {
                inflight.add(CompletableFuture.runAsync(() -> {
                    try {
                        runStep(runId, step, ctx, firstFailure);
                    } finally {
                        gate.release();
                    }
                }, dispatchPool));
            } catch (RejectedExecutionException e) {
                gate.release();
                fail(runId, step, e, firstFailure);
            }
        }

        CompletableFuture.allOf(inflight.toArray(new CompletableFuture[0])).join();

        WorkflowException failure = firstFailure.get();
        if (failure == null) {
            completeRun(runId, workflow);
        }
        return new Submission(runId, failure, null);
    }

    private void runStep(String runId, Step step, Context ctx, AtomicReference<WorkflowException> firstFailure) {
        MDC.put("runId", runId);
        MDC.put("step", step.name());
        try {
            store.updateStepState(runId, step.name(), WorkflowState.RUNNING, null, null);
            StepResult result = stepExecutor.execute(step, ctx);

            if (!result.succeeded()) {
                fail(runId, step, result.failure(), firstFailure);
                return;
            }
            Object output = result.output();
            ctx.put(step.name(), output);
            store.putContextValue(runId, step.name(), output);
            store.updateStepState(runId, step.name(), WorkflowState.COMPLETED, output, null);
            recordEvent(runId, "STEP_SUCCESS", Map.of("workflow_id", runId, "step", step.name()));
            countOutcome("completed");
            log.info("Step '{}' completed in {} ms", step.name(), result.elapsed().toMillis());
        } catch (RuntimeException e) {
            // Store errors (lost races, serialization) fail the step like any other error.
            fail(runId, step, e, firstFailure);
        } finally {
            MDC.remove("step");
            MDC.remove("runId");
        }
    }

    private void fail(String runId, Step step, Throwable cause, AtomicReference<WorkflowException> firstFailure) {
        String message = describe(cause);
        String runError = "Step '" + step.name() + "' failed: " + message;
        firstFailure.compareAndSet(null, new WorkflowException(step.name(), runError, cause));
        countOutcome("failed");
        log.warn("Step '{}' of run {} failed: {}", step.name(), runId, message);

        tryUpdate(() -> store.updateStepState(runId, step.name(), WorkflowState.FAILED, null, message),
                runId, step.name());
        tryUpdate(() -> store.updateWorkflowState(runId, WorkflowState.FAILED, runError), runId, null);

        if (history != null) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("step", step.name());
            String tool = failingTool(cause);
            if (tool != null) {
                metadata.put("tool", tool);
            }
            history.recordErrorEvent(runId, runError, metadata);
        }
    }

    private void skip(String runId, Step step, WorkflowException cause) {
        String message = "cancelled: sibling step '" + cause.getStepName() + "' failed";
        countOutcome("skipped");
        log.info("Step '{}' of run {} not started: {}", step.name(), runId, message);
        tryUpdate(() -> store.updateStepState(runId, step.name(), WorkflowState.FAILED, null, message),
                runId, step.name());
    }

    private void completeRun(String runId, Workflow workflow) {
        tryUpdate(() -> store.updateWorkflowState(runId, WorkflowState.COMPLETED, null), runId, null);
        recordEvent(runId, "WORKFLOW_COMPLETE", Map.of("workflow_id", runId, "name", workflow.name()));
        log.info("Run {} of '{}' completed", runId, workflow.name());
    }

    private void tryUpdate(Runnable update, String runId, String stepName) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("Checkpoint update for run {}{} failed: {}", runId,
                    stepName == null ? "" : " step '" + stepName + "'", e.getMessage());
        }
    }

    private void recordEvent(String runId, String type, Map<String, Object> payload) {
        if (history != null) {
            history.recordWorkflowEvent(runId, type, payload);
        }
    }

    private void countOutcome(String outcome) {
        meterRegistry.counter(OUTCOME_METRIC, "outcome", outcome).increment();
    }

    private static String failingTool(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof ToolException toolFailure) {
                return toolFailure.getToolName();
            }
            if (t.getCause() == t) break;
        }
        return null;
    }

    static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
