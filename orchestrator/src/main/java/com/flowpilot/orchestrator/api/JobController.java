package com.flowpilot.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowpilot.orchestrator.api.dto.LogResponse;
import com.flowpilot.orchestrator.api.dto.StepRecordResponse;
import com.flowpilot.orchestrator.api.dto.SubmitJobRequest;
import com.flowpilot.orchestrator.api.dto.SubmitJobResponse;
import com.flowpilot.orchestrator.api.dto.WorkflowRunResponse;
import com.flowpilot.orchestrator.model.RunNotFoundException;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.service.DistributedRunner;
import com.flowpilot.orchestrator.service.SubmitOptions;
import com.flowpilot.orchestrator.workflow.Workflow;
import com.flowpilot.orchestrator.workflow.WorkflowDefinitionException;
import com.flowpilot.orchestrator.workflow.WorkflowLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for workflow runs.
 *
 * POST /jobs            : submit a workflow (file reference or inline definition)
 * GET  /jobs/{id}       : current snapshot of a run
 * GET  /jobs/{id}/steps : step checkpoints in definition order
 * GET  /jobs/{id}/log   : audit log lines of a run
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final DistributedRunner runner;
    private final WorkflowLoader    loader;

    public JobController(DistributedRunner runner, WorkflowLoader loader) {
        this.runner = runner;
        this.loader = loader;
    }

    /**
     * Submit a workflow as a distributed run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"workflow":{"name":"demo","steps":[{"name":"a","action":"set:x=1"}]}}'
     *
     * Without {@code deferred} the request returns once every step has
     * settled; with it the run is created PENDING and left to the worker.
     */
    @PostMapping
    public ResponseEntity<SubmitJobResponse> submit(@RequestBody SubmitJobRequest req) {
        Workflow workflow = resolve(req.workflow());
        SubmitOptions options = new SubmitOptions(req.deferred(), req.maxParallel());
        String runId = runner.submit(workflow, req.context(), options, true);
        WorkflowRun run = runner.getRun(runId);
        log.info("Accepted run {} of '{}' ({})", runId, workflow.name(), run.state());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SubmitJobResponse(runId, run.state()));
    }

    /**
     * Returns 404 if the run ID is not found.
     */
    @GetMapping("/{id}")
    public WorkflowRunResponse getRun(@PathVariable String id) {
        return WorkflowRunResponse.from(find(id));
    }

    @GetMapping("/{id}/steps")
    public List<StepRecordResponse> getSteps(@PathVariable String id) {
        return find(id).steps().values().stream()
                .map(StepRecordResponse::from)
                .toList();
    }

    @GetMapping("/{id}/log")
    public LogResponse getLog(@PathVariable String id) {
        find(id);
        return new LogResponse(id, runner.getLogs(id));
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler({WorkflowDefinitionException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badDefinition(RuntimeException e) {
        log.warn("Rejected submission: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private WorkflowRun find(String id) {
        try {
            return runner.getRun(id);
        } catch (RunNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
        }
    }

    private Workflow resolve(JsonNode workflow) {
        if (workflow == null || workflow.isNull()) {
            throw new WorkflowDefinitionException("Request must include a 'workflow'");
        }
        if (workflow.isTextual()) {
            return loader.load(workflow.asText());
        }
        return loader.fromTree(workflow);
    }
}
