package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.StepEntity;
import com.flowpilot.orchestrator.model.StepKey;
import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowEntity;
import com.flowpilot.orchestrator.model.WorkflowLogEntity;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.repository.StepRepository;
import com.flowpilot.orchestrator.repository.WorkflowLogRepository;
import com.flowpilot.orchestrator.repository.WorkflowRepository;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable checkpoint store backed by the workflows / steps / workflow_logs
 * tables.
 *
 * Every mutating method runs in its own transaction and starts by taking a
 * pessimistic write lock on the run's row ({@link WorkflowRepository#lockById}).
 * Step updates lock the parent run too, so all writers to one run queue up
 * behind each other while different runs proceed independently.
 */
@Transactional
public class JpaCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCheckpointStore.class);

    private final WorkflowRepository    workflowRepository;
    private final StepRepository        stepRepository;
    private final WorkflowLogRepository logRepository;
    private final BlobCodec             codec;

    public JpaCheckpointStore(WorkflowRepository workflowRepository,
                              StepRepository stepRepository,
                              WorkflowLogRepository logRepository,
                              BlobCodec codec) {
        this.workflowRepository = workflowRepository;
        this.stepRepository     = stepRepository;
        this.logRepository      = logRepository;
        this.codec              = codec;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public String createWorkflowRun(WorkflowDefinition definition,
                                    Map<String, Object> initialContext,
                                    Map<String, Object> metadata) {
        String runId = UUID.randomUUID().toString();
        WorkflowEntity run = new WorkflowEntity(
                runId,
                codec.write(definition),
                codec.write(initialContext == null ? Map.of() : initialContext),
                codec.write(metadata == null ? Map.of() : metadata),
                Instant.now());
        workflowRepository.save(run);

        int position = 0;
        for (StepDefinition step : definition.steps()) {
            stepRepository.save(new StepEntity(runId, step.name(), position++));
        }
        log.debug("Checkpointed new run {} ({} steps)", runId, definition.steps().size());
        return runId;
    }

    @Override
    public void updateWorkflowState(String runId, WorkflowState newState, String error) {
        WorkflowEntity run = lock(runId);
        WorkflowState current = run.getState();
        current.checkTransition(newState);
        if (current.isTerminal()) {
            return;
        }
        run.setError(Transitions.runError(current, newState, run.getError(), error));
        run.setState(newState);
        run.setUpdatedAt(Instant.now());
        workflowRepository.save(run);
    }

    @Override
    public void updateStepState(String runId, String stepName, WorkflowState newState, Object output, String error) {
        WorkflowEntity run = lock(runId);
        StepEntity step = stepRepository.findById(new StepKey(runId, stepName))
                .orElseThrow(() -> new RunNotFoundException(runId, stepName));

        WorkflowState current = step.getState();
        current.checkTransition(newState);
        if (current.isTerminal()) {
            return;
        }
        Instant now = Instant.now();
        if (newState == WorkflowState.RUNNING) {
            step.setStartedAt(now);
            step.setFinishedAt(null);
        }
        if (newState == WorkflowState.COMPLETED || newState == WorkflowState.FAILED) {
            if (step.getStartedAt() == null) {
                step.setStartedAt(now);
            }
            step.setFinishedAt(now);
        }
        if (newState == WorkflowState.RETRYING) {
            step.incrementRetries();
        }
        step.setState(newState);
        step.setOutput(codec.write(output));
        step.setError(error);
        stepRepository.save(step);

        run.setUpdatedAt(now);
        workflowRepository.save(run);
    }

    @Override
    public void putContextValue(String runId, String key, Object value) {
        WorkflowEntity run = lock(runId);
        Map<String, Object> context = codec.readMap(run.getContext());
        context.put(key, value);
        run.setContext(codec.write(context));
        run.setUpdatedAt(Instant.now());
        workflowRepository.save(run);
    }

    @Override
    public void appendLog(String runId, String message) {
        if (!workflowRepository.existsById(runId)) {
            log.debug("Dropping log line for unknown run {}", runId);
            return;
        }
        logRepository.save(new WorkflowLogEntity(runId, message));
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public WorkflowRun getWorkflowState(String runId) {
        WorkflowEntity run = workflowRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        return toSnapshot(run);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowRun> listActiveWorkflows() {
        return workflowRepository.findByStateNotOrderByCreatedAtAsc(WorkflowState.COMPLETED).stream()
                .map(this::toSnapshot)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getLogs(String runId) {
        return logRepository.findByWorkflowIdOrderByIdAsc(runId).stream()
                .map(WorkflowLogEntity::getMessage)
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WorkflowEntity lock(String runId) {
        return workflowRepository.lockById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    private WorkflowRun toSnapshot(WorkflowEntity run) {
        Map<String, StepRecord> steps = new LinkedHashMap<>();
        for (StepEntity step : stepRepository.findByIdWorkflowIdOrderByPositionAsc(run.getId())) {
            steps.put(step.getName(), new StepRecord(
                    step.getName(),
                    step.getState(),
                    step.getInput() == null ? null : codec.readMap(step.getInput()),
                    codec.readValue(step.getOutput()),
                    step.getError(),
                    step.getStartedAt(),
                    step.getFinishedAt(),
                    step.getRetries()));
        }
        return new WorkflowRun(
                run.getId(),
                codec.readDefinition(run.getDefinition()),
                codec.readMap(run.getContext()),
                codec.readMap(run.getMetadata()),
                run.getState(),
                steps,
                run.getCreatedAt(),
                run.getUpdatedAt(),
                run.getError());
    }
}
