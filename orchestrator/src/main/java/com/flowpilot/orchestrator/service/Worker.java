package com.flowpilot.orchestrator.service;

import com.flowpilot.orchestrator.checkpoint.CheckpointStore;
import com.flowpilot.orchestrator.model.InvalidStateTransitionException;
import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Polls the checkpoint store and advances deferred runs that have PENDING steps.
 *
 * The store is the queue: each {@link #runOnce()} takes the oldest active run
 * submitted with {@code deferred} and moves one PENDING step forward. Runs a
 * live submission is still dispatching are never touched. Advancement is a
 * placeholder that records {@code {"worker": "ok"}} as the step output.
 *
 * Several workers may poll the same store; a lost race surfaces as an
 * {@link InvalidStateTransitionException}, which is logged and counted as
 * work done so the loop polls again right away.
 */
public class Worker {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    static final Map<String, Object> PLACEHOLDER_OUTPUT = Map.of("worker", "ok");

    private final CheckpointStore store;
    private volatile boolean      running;

    public Worker(CheckpointStore store) {
        this.store = store;
    }

    /**
     * Advance one PENDING step of the oldest eligible run.
     *
     * Only runs whose metadata carries {@code options.deferred = true} are
     * eligible. Runs that can no longer enter RUNNING (FAILED) are left alone
     * even if they still hold PENDING steps.
     *
     * @return whether any work was found
     */
    public boolean runOnce() {
        for (WorkflowRun run : store.listActiveWorkflows()) {
            if (!SubmitOptions.isDeferred(run.metadata())) {
                continue;
            }
            if (run.state() != WorkflowState.RUNNING && !run.state().canTransitionTo(WorkflowState.RUNNING)) {
                continue;
            }
            Optional<StepRecord> pending = run.steps().values().stream()
                    .filter(s -> s.state() == WorkflowState.PENDING)
                    .findFirst();
            if (pending.isEmpty()) {
                continue;
            }
            advance(run, pending.get().name());
            return true;
        }
        return false;
    }

    private void advance(WorkflowRun run, String stepName) {
        MDC.put("runId", run.id());
        MDC.put("step", stepName);
        try {
            if (run.state() != WorkflowState.RUNNING) {
                store.updateWorkflowState(run.id(), WorkflowState.RUNNING, null);
            }
            store.updateStepState(run.id(), stepName, WorkflowState.RUNNING, null, null);
            store.updateStepState(run.id(), stepName, WorkflowState.COMPLETED, PLACEHOLDER_OUTPUT, null);
            log.info("Worker advanced step '{}'", stepName);

            WorkflowRun refreshed = store.getWorkflowState(run.id());
            if (refreshed.allStepsCompleted()) {
                store.updateWorkflowState(run.id(), WorkflowState.COMPLETED, null);
                log.info("Worker completed run {}", run.id());
            }
        } catch (InvalidStateTransitionException e) {
            log.warn("Lost a race advancing run {} step '{}': {}", run.id(), stepName, e.getMessage());
        } finally {
            MDC.remove("step");
            MDC.remove("runId");
        }
    }

    // ------------------------------------------------------------------
    // Polling loop
    // ------------------------------------------------------------------

    /**
     * Call {@link #runOnce()} repeatedly on the current thread, sleeping for
     * {@code pollInterval} whenever there is nothing to do, until
     * {@link #stop()} is called or the thread is interrupted.
     */
    public void runForever(Duration pollInterval) {
        running = true;
        log.info("Worker loop started (poll interval {} ms)", pollInterval.toMillis());
        while (running && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = runOnce();
            } catch (RuntimeException e) {
                log.error("Worker iteration failed: {}", e.getMessage(), e);
                worked = false;
            }
            if (!worked) {
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        running = false;
        log.info("Worker loop stopped");
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
