package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.model.InvalidStateTransitionException;
import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.StepType;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static com.flowpilot.orchestrator.model.WorkflowState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link CheckpointStore} backend must share. Subclasses
 * supply the store under test.
 */
abstract class AbstractCheckpointStoreTest {

    static final WorkflowDefinition TWO_STEPS = new WorkflowDefinition("two", List.of(
            new StepDefinition("a", StepType.TASK, null),
            new StepDefinition("b", StepType.TASK, 1000L)));

    // Shortest sequence of transitions that moves a fresh run into each state.
    static final Map<WorkflowState, List<WorkflowState>> PATHS = Map.of(
            PENDING,   List.of(),
            RUNNING,   List.of(RUNNING),
            WAITING,   List.of(RUNNING, WAITING),
            RETRYING,  List.of(RETRYING),
            FAILED,    List.of(FAILED),
            COMPLETED, List.of(RUNNING, COMPLETED));

    CheckpointStore store;

    abstract CheckpointStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    String newRun() {
        return store.createWorkflowRun(TWO_STEPS, Map.of("seed", 1), Map.of("options", Map.of("deferred", false)));
    }

    static Stream<Arguments> illegalTransitions() {
        List<Arguments> pairs = new ArrayList<>();
        for (WorkflowState from : WorkflowState.values()) {
            for (WorkflowState to : WorkflowState.values()) {
                if (!from.canTransitionTo(to)) {
                    pairs.add(Arguments.of(from, to));
                }
            }
        }
        return pairs.stream();
    }

    static Stream<Arguments> legalTransitions() {
        List<Arguments> pairs = new ArrayList<>();
        for (WorkflowState from : WorkflowState.values()) {
            for (WorkflowState to : WorkflowState.values()) {
                if (from.canTransitionTo(to)) {
                    pairs.add(Arguments.of(from, to));
                }
            }
        }
        return pairs.stream();
    }

    // ------------------------------------------------------------------
    // createWorkflowRun()
    // ------------------------------------------------------------------

    @Test
    void create_newRun_isPendingWithPendingStepsInOrder() {
        String runId = newRun();

        WorkflowRun run = store.getWorkflowState(runId);

        assertThat(run.id()).isEqualTo(runId);
        assertThat(run.state()).isEqualTo(PENDING);
        assertThat(run.definition()).isEqualTo(TWO_STEPS);
        assertThat(run.context()).containsEntry("seed", 1);
        assertThat(run.metadata()).containsKey("options");
        assertThat(run.steps()).containsOnlyKeys("a", "b");
        assertThat(run.steps().keySet()).containsExactly("a", "b");
        assertThat(run.steps().values()).allMatch(s -> s.state() == PENDING && s.retries() == 0);
        assertThat(run.createdAt()).isNotNull();
    }

    // ------------------------------------------------------------------
    // Transition validation
    // ------------------------------------------------------------------

    @ParameterizedTest(name = "{0} -> {1} rejected")
    @MethodSource("illegalTransitions")
    void updateWorkflowState_illegalTransition_rejectedWithoutMutation(WorkflowState from, WorkflowState to) {
        String runId = newRun();
        PATHS.get(from).forEach(s -> store.updateWorkflowState(runId, s, null));
        WorkflowRun before = store.getWorkflowState(runId);

        assertThatThrownBy(() -> store.updateWorkflowState(runId, to, "should not stick"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessage("Cannot transition from " + from + " to " + to);

        WorkflowRun after = store.getWorkflowState(runId);
        assertThat(after.state()).isEqualTo(from);
        assertThat(after.error()).isEqualTo(before.error());
        assertThat(after.updatedAt()).isEqualTo(before.updatedAt());
    }

    @ParameterizedTest(name = "{0} -> {1} accepted")
    @MethodSource("legalTransitions")
    void updateWorkflowState_legalTransition_applied(WorkflowState from, WorkflowState to) {
        String runId = newRun();
        PATHS.get(from).forEach(s -> store.updateWorkflowState(runId, s, null));

        store.updateWorkflowState(runId, to, null);

        assertThat(store.getWorkflowState(runId).state()).isEqualTo(to);
    }

    @Test
    void updateStepState_illegalTransition_rejected() {
        String runId = newRun();

        assertThatThrownBy(() -> store.updateStepState(runId, "a", COMPLETED, "x", null))
                .isInstanceOf(InvalidStateTransitionException.class);

        StepRecord step = store.getWorkflowState(runId).step("a");
        assertThat(step.state()).isEqualTo(PENDING);
        assertThat(step.output()).isNull();
    }

    @Test
    void updateWorkflowState_completedTwice_isNoOp() {
        String runId = newRun();
        store.updateWorkflowState(runId, RUNNING, null);
        store.updateWorkflowState(runId, COMPLETED, null);
        WorkflowRun first = store.getWorkflowState(runId);

        store.updateWorkflowState(runId, COMPLETED, "ignored");

        WorkflowRun second = store.getWorkflowState(runId);
        assertThat(second.state()).isEqualTo(COMPLETED);
        assertThat(second.updatedAt()).isEqualTo(first.updatedAt());
        assertThat(second.error()).isNull();
    }

    @Test
    void updateWorkflowState_failedTwice_keepsFirstError() {
        String runId = newRun();

        store.updateWorkflowState(runId, FAILED, "Step 'a' failed: first");
        store.updateWorkflowState(runId, FAILED, "Step 'b' failed: second");

        assertThat(store.getWorkflowState(runId).error()).isEqualTo("Step 'a' failed: first");
    }

    // ------------------------------------------------------------------
    // Step bookkeeping
    // ------------------------------------------------------------------

    @Test
    void updateStepState_setsTimestampsAndOutput() {
        String runId = newRun();

        store.updateStepState(runId, "a", RUNNING, null, null);
        StepRecord running = store.getWorkflowState(runId).step("a");
        store.updateStepState(runId, "a", COMPLETED, Map.of("rows", 3), null);
        StepRecord done = store.getWorkflowState(runId).step("a");

        assertThat(running.startedAt()).isNotNull();
        assertThat(running.finishedAt()).isNull();
        assertThat(done.state()).isEqualTo(COMPLETED);
        assertThat(done.output()).isEqualTo(Map.of("rows", 3));
        assertThat(done.finishedAt()).isNotNull().isAfterOrEqualTo(done.startedAt());
    }

    @Test
    void updateStepState_failedFromPending_setsBothTimestamps() {
        String runId = newRun();

        store.updateStepState(runId, "b", FAILED, null, "cancelled");

        StepRecord step = store.getWorkflowState(runId).step("b");
        assertThat(step.error()).isEqualTo("cancelled");
        assertThat(step.startedAt()).isNotNull();
        assertThat(step.finishedAt()).isNotNull();
    }

    @Test
    void updateStepState_retrying_countsRetries() {
        String runId = newRun();

        store.updateStepState(runId, "a", RUNNING, null, null);
        store.updateStepState(runId, "a", RETRYING, null, "flaky");
        store.updateStepState(runId, "a", RUNNING, null, null);
        store.updateStepState(runId, "a", RETRYING, null, "flaky again");

        assertThat(store.getWorkflowState(runId).step("a").retries()).isEqualTo(2);
    }

    @Test
    void updateStepState_bumpsRunUpdatedAt() throws Exception {
        String runId = newRun();
        WorkflowRun before = store.getWorkflowState(runId);
        Thread.sleep(5);

        store.updateStepState(runId, "a", RUNNING, null, null);

        assertThat(store.getWorkflowState(runId).updatedAt()).isAfter(before.updatedAt());
    }

    @Test
    void putContextValue_visibleInSnapshot() {
        String runId = newRun();

        store.putContextValue(runId, "a", List.of("x", "y"));

        assertThat(store.getWorkflowState(runId).context())
                .containsEntry("seed", 1)
                .containsEntry("a", List.of("x", "y"));
    }

    // ------------------------------------------------------------------
    // Unknown ids
    // ------------------------------------------------------------------

    @Test
    void unknownRun_throwsRunNotFound() {
        assertThatThrownBy(() -> store.getWorkflowState("no-such-run"))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> store.updateWorkflowState("no-such-run", RUNNING, null))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> store.updateStepState("no-such-run", "a", RUNNING, null, null))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void unknownStep_throwsRunNotFound() {
        String runId = newRun();

        assertThatThrownBy(() -> store.updateStepState(runId, "zzz", RUNNING, null, null))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("zzz");
    }

    // ------------------------------------------------------------------
    // Listing and logs
    // ------------------------------------------------------------------

    @Test
    void listActiveWorkflows_excludesCompletedKeepsFailedOldestFirst() throws Exception {
        String done = newRun();
        store.updateWorkflowState(done, RUNNING, null);
        store.updateWorkflowState(done, COMPLETED, null);
        String failed = newRun();
        Thread.sleep(5);
        store.updateWorkflowState(failed, FAILED, "boom");
        String pending = newRun();

        List<String> active = store.listActiveWorkflows().stream()
                .map(WorkflowRun::id)
                .filter(id -> id.equals(done) || id.equals(failed) || id.equals(pending))
                .toList();

        assertThat(active).containsExactly(failed, pending);
    }

    @Test
    void logs_appendedInOrder_unknownRunIgnored() {
        String runId = newRun();

        store.appendLog(runId, "agent_started: distributed=true");
        store.appendLog(runId, "retry_attempt:1");
        store.appendLog("no-such-run", "lost");

        assertThat(store.getLogs(runId)).containsExactly("agent_started: distributed=true", "retry_attempt:1");
        assertThat(store.getLogs("no-such-run")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentStepUpdates_allApplied() throws Exception {
        int stepCount = 8;
        List<StepDefinition> steps = new ArrayList<>();
        for (int i = 0; i < stepCount; i++) {
            steps.add(new StepDefinition("s" + i, StepType.TASK, null));
        }
        String runId = store.createWorkflowRun(new WorkflowDefinition("wide", steps), Map.of(), Map.of());
        store.updateWorkflowState(runId, RUNNING, null);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < stepCount; i++) {
                String name = "s" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.updateStepState(runId, name, RUNNING, null, null);
                    store.putContextValue(runId, name, name.toUpperCase());
                    store.updateStepState(runId, name, COMPLETED, name.toUpperCase(), null);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        WorkflowRun run = store.getWorkflowState(runId);
        assertThat(run.allStepsCompleted()).isTrue();
        assertThat(run.context()).hasSize(stepCount).containsEntry("s3", "S3");
    }
}
