package com.flowpilot.orchestrator.service;

import com.flowpilot.orchestrator.checkpoint.InMemoryCheckpointStore;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.workflow.Step;
import com.flowpilot.orchestrator.workflow.StepAction;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.StepExecutor;
import com.flowpilot.orchestrator.workflow.StepType;
import com.flowpilot.orchestrator.workflow.Workflow;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerTest {

    static final WorkflowDefinition ONE_STEP = new WorkflowDefinition("single",
            List.of(new StepDefinition("only", StepType.TASK, null)));

    static final Map<String, Object> DEFERRED = Map.of("options", SubmitOptions.deferredRun().toMap());

    InMemoryCheckpointStore store;
    Worker worker;

    @BeforeEach
    void setUp() {
        store  = new InMemoryCheckpointStore();
        worker = new Worker(store);
    }

    @Test
    void runOnce_pendingStep_advancedThenIdle() {
        String runId = store.createWorkflowRun(ONE_STEP, Map.of(), DEFERRED);

        assertThat(worker.runOnce()).isTrue();
        assertThat(worker.runOnce()).isFalse();

        WorkflowRun run = store.getWorkflowState(runId);
        assertThat(run.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(run.step("only").state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(run.step("only").output()).isEqualTo(Map.of("worker", "ok"));
    }

    @Test
    void runOnce_advancesOneStepPerCall() {
        WorkflowDefinition twoSteps = new WorkflowDefinition("pair", List.of(
                new StepDefinition("a", StepType.TASK, null),
                new StepDefinition("b", StepType.TASK, null)));
        String runId = store.createWorkflowRun(twoSteps, Map.of(), DEFERRED);

        worker.runOnce();

        WorkflowRun run = store.getWorkflowState(runId);
        assertThat(run.state()).isEqualTo(WorkflowState.RUNNING);
        assertThat(run.step("a").state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(run.step("b").state()).isEqualTo(WorkflowState.PENDING);
    }

    @Test
    void runOnce_emptyStore_returnsFalse() {
        assertThat(worker.runOnce()).isFalse();
    }

    @Test
    void runOnce_failedRun_leftAlone() {
        String runId = store.createWorkflowRun(ONE_STEP, Map.of(), DEFERRED);
        store.updateWorkflowState(runId, WorkflowState.FAILED, "Step 'x' failed: y");

        assertThat(worker.runOnce()).isFalse();
        assertThat(store.getWorkflowState(runId).step("only").state()).isEqualTo(WorkflowState.PENDING);
    }

    @Test
    void runOnce_runNotSubmittedAsDeferred_leftAlone() {
        String runId = store.createWorkflowRun(ONE_STEP, Map.of(),
                Map.of("options", SubmitOptions.defaults().toMap()));
        store.updateWorkflowState(runId, WorkflowState.RUNNING, null);

        assertThat(worker.runOnce()).isFalse();
        assertThat(store.getWorkflowState(runId).step("only").state()).isEqualTo(WorkflowState.PENDING);
    }

    @Test
    void runOnce_concurrentWithLiveSubmit_doesNotTouchDispatchedRun() throws Exception {
        CountDownLatch aStarted = new CountDownLatch(1);
        CountDownLatch releaseA = new CountDownLatch(1);
        Workflow workflow = Workflow.of("live",
                new Step("a", ctx -> {
                    aStarted.countDown();
                    releaseA.await(5, TimeUnit.SECONDS);
                    return "A";
                }),
                new Step("b", StepAction.constant("B")));

        StepExecutor stepExecutor = new StepExecutor(2);
        ExecutorService dispatchPool = Executors.newFixedThreadPool(2);
        ExecutorService submitter = Executors.newSingleThreadExecutor();
        try {
            DistributedRunner runner = new DistributedRunner(store, stepExecutor, dispatchPool, 1,
                    null, new SimpleMeterRegistry());
            Future<String> submitted = submitter.submit(() ->
                    runner.submit(workflow, Map.of(), new SubmitOptions(false, 1), true));

            assertThat(aStarted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.runOnce()).isFalse();
            releaseA.countDown();

            WorkflowRun run = store.getWorkflowState(submitted.get(5, TimeUnit.SECONDS));
            assertThat(run.state()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(run.step("a").output()).isEqualTo("A");
            assertThat(run.step("b").output()).isEqualTo("B");
        } finally {
            releaseA.countDown();
            submitter.shutdownNow();
            dispatchPool.shutdownNow();
            stepExecutor.close();
        }
    }

    @Test
    void runForever_drainsStoreUntilStopped() throws Exception {
        String runId = store.createWorkflowRun(ONE_STEP, Map.of(), DEFERRED);
        Thread loop = new Thread(() -> worker.runForever(Duration.ofMillis(10)), "worker-test");
        loop.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (store.getWorkflowState(runId).state() != WorkflowState.COMPLETED && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        worker.stop();
        loop.join(2_000);

        assertThat(store.getWorkflowState(runId).state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(loop.isAlive()).isFalse();
        assertThat(worker.isRunning()).isFalse();
    }
}
