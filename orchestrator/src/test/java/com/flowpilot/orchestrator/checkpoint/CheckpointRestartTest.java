package com.flowpilot.orchestrator.checkpoint;

import com.flowpilot.orchestrator.FlowPilotApplication;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.StepType;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * A run checkpointed by one application instance is visible, unchanged, to
 * the next instance started against the same database file.
 */
class CheckpointRestartTest {

    @TempDir
    Path dataDir;

    @Test
    void checkpoint_survivesApplicationRestart() {
        String url = "jdbc:h2:file:" + dataDir.resolve("flowpilot").toAbsolutePath() + ";LOCK_TIMEOUT=10000";
        WorkflowDefinition definition = new WorkflowDefinition("restart", List.of(
                new StepDefinition("first", StepType.TASK, null),
                new StepDefinition("second", StepType.TASK, null)));

        String runId;
        WorkflowRun before;
        try (ConfigurableApplicationContext ctx = start(url)) {
            CheckpointStore store = ctx.getBean(CheckpointStore.class);
            runId = store.createWorkflowRun(definition, Map.of("input", "x"),
                    Map.of("options", Map.of("deferred", false, "max_parallel", 2)));
            store.updateWorkflowState(runId, WorkflowState.RUNNING, null);
            store.updateStepState(runId, "first", WorkflowState.RUNNING, null, null);
            store.updateStepState(runId, "first", WorkflowState.COMPLETED, "done", null);
            store.putContextValue(runId, "first", "done");
            store.updateStepState(runId, "second", WorkflowState.RUNNING, null, null);
            store.updateStepState(runId, "second", WorkflowState.RETRYING, null, "flaky upstream");
            store.appendLog(runId, "checkpointed before shutdown");
            before = store.getWorkflowState(runId);
        }

        try (ConfigurableApplicationContext ctx = start(url)) {
            CheckpointStore store = ctx.getBean(CheckpointStore.class);
            WorkflowRun run = store.getWorkflowState(runId);

            assertThat(run).usingRecursiveComparison().ignoringFieldsOfTypes(Instant.class).isEqualTo(before);
            assertThat(run.state()).isEqualTo(WorkflowState.RUNNING);
            assertThat(run.metadata()).containsEntry("options", Map.of("deferred", false, "max_parallel", 2));
            assertThat(run.definition()).isEqualTo(definition);
            assertThat(run.context()).containsEntry("input", "x").containsEntry("first", "done");
            assertThat(run.step("first").state()).isEqualTo(WorkflowState.COMPLETED);
            assertThat(run.step("first").output()).isEqualTo("done");
            assertThat(run.step("second").state()).isEqualTo(WorkflowState.RETRYING);
            assertThat(run.step("second").error()).isEqualTo("flaky upstream");
            assertThat(run.step("second").retries()).isEqualTo(1);
            assertThat(store.listActiveWorkflows()).extracting(WorkflowRun::id).contains(runId);
            assertThat(store.getLogs(runId)).containsExactly("checkpointed before shutdown");
        }
    }

    private static ConfigurableApplicationContext start(String url) {
        return new SpringApplicationBuilder(FlowPilotApplication.class)
                .web(WebApplicationType.NONE)
                .properties(
                        "spring.datasource.url=" + url,
                        "flowpilot.checkpoint.backend=jdbc",
                        "flowpilot.worker.enabled=false")
                .run();
    }
}
