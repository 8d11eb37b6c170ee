package com.flowpilot.orchestrator.api;

import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.StepRecord;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.service.DistributedRunner;
import com.flowpilot.orchestrator.service.SubmitOptions;
import com.flowpilot.orchestrator.workflow.Step;
import com.flowpilot.orchestrator.workflow.StepAction;
import com.flowpilot.orchestrator.workflow.StepDefinition;
import com.flowpilot.orchestrator.workflow.StepType;
import com.flowpilot.orchestrator.workflow.Workflow;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;
import com.flowpilot.orchestrator.workflow.WorkflowDefinitionException;
import com.flowpilot.orchestrator.workflow.WorkflowLoader;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * Only the web layer starts; the runner and the loader are mocks.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean DistributedRunner runner;
    @MockitoBean WorkflowLoader    loader;

    static final Workflow DEMO = Workflow.of("demo", new Step("a", StepAction.constant(1)));

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submit_fileReference_returns201WithRunState() throws Exception {
        when(loader.load("demo.yaml")).thenReturn(DEMO);
        when(runner.submit(eq(DEMO), anyMap(), any(SubmitOptions.class), eq(true))).thenReturn("run-1");
        when(runner.getRun("run-1")).thenReturn(fakeRun("run-1", WorkflowState.COMPLETED));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workflow":"demo.yaml","context":{"x":1}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("run-1"))
                .andExpect(jsonPath("$.state").value("COMPLETED"));

        verify(runner).submit(DEMO, Map.of("x", 1), new SubmitOptions(false, null), true);
    }

    @Test
    void submit_inlineDeferred_passesOptionsThrough() throws Exception {
        when(loader.fromTree(any())).thenReturn(DEMO);
        when(runner.submit(eq(DEMO), anyMap(), any(SubmitOptions.class), eq(true))).thenReturn("run-2");
        when(runner.getRun("run-2")).thenReturn(fakeRun("run-2", WorkflowState.PENDING));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workflow":{"name":"demo","steps":[{"name":"a","action":"set:x=1"}]},
                                 "deferred":true,"maxParallel":2}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("PENDING"));

        verify(runner).submit(DEMO, Map.of(), new SubmitOptions(true, 2), true);
    }

    @Test
    void submit_missingWorkflow_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Request must include a 'workflow'"));
    }

    @Test
    void submit_invalidDefinition_returns400() throws Exception {
        when(loader.fromTree(any())).thenThrow(new WorkflowDefinitionException("Unknown action 'bogus'"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workflow":{"name":"x","steps":[{"name":"a","action":"bogus"}]}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown action 'bogus'"));
    }

    @Test
    void submit_zeroMaxParallel_returns400() throws Exception {
        when(loader.load("demo.yaml")).thenReturn(DEMO);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workflow":"demo.yaml","maxParallel":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}, /steps, /log
    // ------------------------------------------------------------------

    @Test
    void getRun_existingId_returns200() throws Exception {
        when(runner.getRun("run-1")).thenReturn(fakeRun("run-1", WorkflowState.FAILED));

        mockMvc.perform(get("/jobs/{id}", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("demo"))
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.steps[0].name").value("a"));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        when(runner.getRun("nope")).thenThrow(new RunNotFoundException("nope"));

        mockMvc.perform(get("/jobs/{id}", "nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getSteps_existingRun_listsStepsInOrder() throws Exception {
        when(runner.getRun("run-1")).thenReturn(fakeRun("run-1", WorkflowState.COMPLETED));

        mockMvc.perform(get("/jobs/{id}/steps", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("a"))
                .andExpect(jsonPath("$[0].state").value("COMPLETED"))
                .andExpect(jsonPath("$[0].output").value(1));
    }

    @Test
    void getLog_existingRun_returnsLines() throws Exception {
        when(runner.getRun("run-1")).thenReturn(fakeRun("run-1", WorkflowState.FAILED));
        when(runner.getLogs("run-1")).thenReturn(List.of("agent_started: distributed=true", "retry_attempt:1"));

        mockMvc.perform(get("/jobs/{id}/log", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("run-1"))
                .andExpect(jsonPath("$.logs[1]").value("retry_attempt:1"));
    }

    @Test
    void getLog_unknownRun_returns404() throws Exception {
        when(runner.getRun("nope")).thenThrow(new RunNotFoundException("nope"));

        mockMvc.perform(get("/jobs/{id}/log", "nope"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkflowRun fakeRun(String id, WorkflowState state) {
        Instant now = Instant.now();
        WorkflowState stepState = state == WorkflowState.COMPLETED ? WorkflowState.COMPLETED : WorkflowState.PENDING;
        Map<String, StepRecord> steps = new LinkedHashMap<>();
        steps.put("a", new StepRecord("a", stepState, null, stepState == WorkflowState.COMPLETED ? 1 : null,
                null, null, null, 0));
        return new WorkflowRun(id,
                new WorkflowDefinition("demo", List.of(new StepDefinition("a", StepType.TASK, null))),
                Map.of(), Map.of(), state, steps, now, now,
                state == WorkflowState.FAILED ? "Step 'a' failed: boom" : null);
    }
}
