package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.model.InvalidStateTransitionException;
import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;

import java.util.List;
import java.util.Map;

/**
 * The single authority for workflow run and step state.
 *
 * Every state change goes through {@link #updateWorkflowState} or
 * {@link #updateStepState}, both of which validate the transition against
 * {@link WorkflowState} and leave the record untouched when it is illegal.
 * Implementations serialize all mutations on one instance, so concurrent
 * callers observe a single writer.
 *
 * Snapshots returned by the read methods are immutable and detached from
 * the store.
 */
public interface CheckpointStore {

    /**
     * Record a new run in PENDING with one PENDING step per defined step.
     *
     * @return the new run id (a random UUID string)
     */
    String createWorkflowRun(WorkflowDefinition definition,
                             Map<String, Object> initialContext,
                             Map<String, Object> metadata);

    /**
     * @throws RunNotFoundException            if the run does not exist
     * @throws InvalidStateTransitionException if the transition is illegal
     */
    void updateWorkflowState(String runId, WorkflowState newState, String error);

    /**
     * Sets started_at on entry to RUNNING and finished_at on entry to
     * COMPLETED or FAILED; entering RETRYING counts one retry.
     *
     * @throws RunNotFoundException            if the run or step does not exist
     * @throws InvalidStateTransitionException if the transition is illegal
     */
    void updateStepState(String runId, String stepName, WorkflowState newState, Object output, String error);

    /**
     * Publish one value into the run's stored context.
     *
     * @throws RunNotFoundException if the run does not exist
     */
    void putContextValue(String runId, String key, Object value);

    /**
     * @throws RunNotFoundException if the run does not exist
     */
    WorkflowRun getWorkflowState(String runId);

    /** Every run whose state is not COMPLETED, oldest first. */
    List<WorkflowRun> listActiveWorkflows();

    /** Best-effort audit line. Unknown runs are ignored. */
    void appendLog(String runId, String message);

    /** Audit lines of a run in append order; empty for unknown runs. */
    List<String> getLogs(String runId);
}
