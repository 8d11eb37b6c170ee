package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local checkpoint store for tests and single-process runs.
 *
 * One lock guards every read and write, so callers always see a consistent
 * snapshot and concurrent mutations are applied one at a time. Nothing
 * survives a restart.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ReentrantLock lock = new ReentrantLock();

    // Insertion order doubles as creation order for listActiveWorkflows().
    private final Map<String, MutableRun>   runs = new LinkedHashMap<>();
    private final Map<String, List<String>> logs = new LinkedHashMap<>();

    @Override
    public String createWorkflowRun(WorkflowDefinition definition,
                                    Map<String, Object> initialContext,
                                    Map<String, Object> metadata) {
        String runId = UUID.randomUUID().toString();
        MutableRun run = new MutableRun(runId, definition, initialContext, metadata);
        lock.lock();
        try {
            runs.put(runId, run);
        } finally {
            lock.unlock();
        }
        return runId;
    }

    @Override
    public void updateWorkflowState(String runId, WorkflowState newState, String error) {
        lock.lock();
        try {
            MutableRun run = require(runId);
            WorkflowState current = run.state;
            current.checkTransition(newState);
            if (current.isTerminal()) {
                return;   // COMPLETED → COMPLETED changes nothing
            }
            run.error     = Transitions.runError(current, newState, run.error, error);
            run.state     = newState;
            run.updatedAt = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateStepState(String runId, String stepName, WorkflowState newState, Object output, String error) {
        lock.lock();
        try {
            MutableRun run = require(runId);
            MutableStep step = run.steps.get(stepName);
            if (step == null) {
                throw new RunNotFoundException(runId, stepName);
            }
            WorkflowState current = step.state;
            current.checkTransition(newState);
            if (current.isTerminal()) {
                return;
            }
            Instant now = Instant.now();
            if (newState == WorkflowState.RUNNING) {
                step.startedAt  = now;
                step.finishedAt = null;
            }
            if (newState == WorkflowState.COMPLETED || newState == WorkflowState.FAILED) {
                if (step.startedAt == null) {
                    step.startedAt = now;
                }
                step.finishedAt = now;
            }
            if (newState == WorkflowState.RETRYING) {
                step.retries++;
            }
            step.state    = newState;
            step.output   = output;
            step.error    = error;
            run.updatedAt = now;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putContextValue(String runId, String key, Object value) {
        lock.lock();
        try {
            MutableRun run = require(runId);
            run.context.put(key, value);
            run.updatedAt = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WorkflowRun getWorkflowState(String runId) {
        lock.lock();
        try {
            return require(runId).snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<WorkflowRun> listActiveWorkflows() {
        lock.lock();
        try {
            return runs.values().stream()
                    .filter(run -> run.state != WorkflowState.COMPLETED)
                    .map(MutableRun::snapshot)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendLog(String runId, String message) {
        lock.lock();
        try {
            if (runs.containsKey(runId)) {
                logs.computeIfAbsent(runId, id -> new ArrayList<>()).add(message);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> getLogs(String runId) {
        lock.lock();
        try {
            return List.copyOf(logs.getOrDefault(runId, List.of()));
        } finally {
            lock.unlock();
        }
    }

    private MutableRun require(String runId) {
        MutableRun run = runs.get(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    // ------------------------------------------------------------------
    // Mutable records, only ever touched while holding the lock
    // ------------------------------------------------------------------

    private static final class MutableRun {
        final String                   id;
        final WorkflowDefinition       definition;
        final Map<String, Object>      context;
        final Map<String, Object>      metadata;
        final Map<String, MutableStep> steps = new LinkedHashMap<>();
        final Instant                  createdAt;
        WorkflowState                  state = WorkflowState.PENDING;
        Instant                        updatedAt;
        String                         error;

        MutableRun(String id, WorkflowDefinition definition,
                   Map<String, Object> initialContext, Map<String, Object> metadata) {
            this.id         = id;
            this.definition = definition;
            this.context    = initialContext == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialContext);
            this.metadata   = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            this.createdAt  = Instant.now();
            this.updatedAt  = createdAt;
            for (StepDefinition step : definition.steps()) {
                steps.put(step.name(), new MutableStep(step.name()));
            }
        }

        WorkflowRun snapshot() {
            Map<String, StepRecord> stepRecords = new LinkedHashMap<>();
            steps.forEach((name, step) -> stepRecords.put(name, step.snapshot()));
            return new WorkflowRun(id, definition, context, metadata, state, stepRecords, createdAt, updatedAt, error);
        }
    }

    private static final class MutableStep {
        final String  name;
        WorkflowState state = WorkflowState.PENDING;
        Object        output;
        String        error;
        Instant       startedAt;
        Instant       finishedAt;
        int           retries;

        MutableStep(String name) {
            this.name = name;
        }

        StepRecord snapshot() {
            return new StepRecord(name, state, null, output, error, startedAt, finishedAt, retries);
        }
    }
}
