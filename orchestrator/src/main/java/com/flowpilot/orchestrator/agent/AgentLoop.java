package com.flowpilot.orchestrator.agent;

import com.flowpilot.orchestrator.checkpoint.CheckpointStore;
import com.flowpilot.orchestrator.critic.Critic;
import com.flowpilot.orchestrator.critic.CriticRegistry;
import com.flowpilot.orchestrator.critic.CriticResult;
import com.flowpilot.orchestrator.history.HistoryStore;
import com.flowpilot.orchestrator.model.WorkflowRun;
import com.flowpilot.orchestrator.model.WorkflowState;
import com.flowpilot.orchestrator.service.DistributedRunner;
import com.flowpilot.orchestrator.service.SubmitOptions;
import com.flowpilot.orchestrator.service.Submission;
import com.flowpilot.orchestrator.tool.ToolException;
import com.flowpilot.orchestrator.workflow.Step;
import com.flowpilot.orchestrator.workflow.Workflow;
import com.flowpilot.orchestrator.workflow.WorkflowException;
import com.flowpilot.orchestrator.workflow.WorkflowLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a workflow and, when it fails, retries it under a correction policy.
 *
 * <p>Flow of one session:
 * <ol>
 *   <li>Submit once (local or distributed). A local run is copied into the
 *       checkpoint store afterwards so the returned id always resolves.</li>
 *   <li>If the run did not complete: up to {@code maxRetries} times, submit
 *       the same workflow and context again in distributed mode. A completed
 *       retry ends the session. A failed one is classified, recorded, and
 *       handed to the policy engine, whose strategy updates the session's
 *       hints. A PERMANENT failure ends the session early.</li>
 * </ol>
 *
 * <p>Every decision is appended to the first run's log as
 * {@code agent_started}, {@code retry_attempt:<n>}, {@code error:<CLASS>}
 * and {@code strategy:<name>}. Workflow failures never escape this class.
 *
 * <p>A session's {@link LoopContext} is dropped when the loop returns, apart
 * from the last {@value #RECENT_SESSIONS} finished sessions kept for
 * {@link #session(String)}.
 */
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);

    // Initial-context keys copied into the session hints.
    private static final List<String> HINT_KEYS = List.of("tool", "task_type", "critical", "last_query");

    private final DistributedRunner    runner;
    private final CheckpointStore      store;
    private final ErrorClassifier      classifier;
    private final PolicyEngine         policyEngine;
    private final CorrectionStrategies strategies;
    private final CriticRegistry       criticRegistry;
    private final HistoryStore         history;        // nullable
    private final WorkflowLoader       loader;
    private final AgentPolicy          defaultPolicy;

    static final int RECENT_SESSIONS = 32;

    // Guarded by itself; evicts the oldest finished session.
    private final Map<String, LoopContext> recentSessions = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, LoopContext> eldest) {
            return size() > RECENT_SESSIONS;
        }
    };

    public AgentLoop(DistributedRunner runner,
                     ErrorClassifier classifier,
                     PolicyEngine policyEngine,
                     CorrectionStrategies strategies,
                     CriticRegistry criticRegistry,
                     HistoryStore history,
                     WorkflowLoader loader,
                     AgentPolicy defaultPolicy) {
        this.runner         = runner;
        this.store          = runner.store();
        this.classifier     = classifier;
        this.policyEngine   = policyEngine;
        this.strategies     = strategies;
        this.criticRegistry = criticRegistry;
        this.history        = history;
        this.loader         = loader;
        this.defaultPolicy  = defaultPolicy != null ? defaultPolicy : AgentPolicy.defaults();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Load a workflow file through the {@link WorkflowLoader} and run it. */
    public String runWithSelfCorrection(String workflowReference, Map<String, Object> initialContext,
                                        AgentPolicy policy, boolean distributed) {
        return runWithSelfCorrection(loader.load(workflowReference), initialContext, policy, distributed);
    }

    /**
     * @param policy null uses the configured default policy
     * @return id of the first run; its log records the whole session
     */
    public String runWithSelfCorrection(Workflow workflow, Map<String, Object> initialContext,
                                        AgentPolicy policy, boolean distributed) {
        AgentPolicy effective = policy != null ? policy : defaultPolicy;
        Map<String, Object> base = initialContext == null ? Map.of() : initialContext;

        Submission first = runner.execute(workflow, base, SubmitOptions.defaults(), distributed);
        String runId = first.local() ? materialize(workflow, base, first) : first.runId();

        MDC.put("runId", runId);
        try {
            LoopContext loop = new LoopContext(runId, seedHints(base, distributed));
            store.appendLog(runId, "agent_started: distributed=" + distributed);
            if (history != null) {
                history.recordAgentDecision(runId, "start", Map.of("distributed", distributed));
            }

            WorkflowRun run = store.getWorkflowState(runId);
            loop.setLastResult(run);
            if (run.state() != WorkflowState.COMPLETED) {
                noteFailingTool(first.failure(), loop);
                attemptCorrections(workflow, base, loop, effective);
            }
            log.info("Agent session for '{}' finished after {} retries", workflow.name(), loop.attempts());
            synchronized (recentSessions) {
                recentSessions.put(runId, loop);
            }
            return runId;
        } finally {
            MDC.remove("runId");
        }
    }

    /** Final state of a recently finished session, if it is still retained. */
    public Optional<LoopContext> session(String runId) {
        synchronized (recentSessions) {
            return Optional.ofNullable(recentSessions.get(runId));
        }
    }

    // ------------------------------------------------------------------
    // Retry loop
    // ------------------------------------------------------------------

    private void attemptCorrections(Workflow workflow, Map<String, Object> base, LoopContext loop, AgentPolicy policy) {
        String logId = loop.originalRunId();
        while (loop.attempts() < policy.maxRetries()) {
            int attempt = loop.incrementAttempts();
            store.appendLog(logId, "retry_attempt:" + attempt);

            Submission retry = runner.execute(workflow, base, SubmitOptions.defaults(), true);
            loop.setWorkflowId(retry.runId());
            WorkflowRun run = store.getWorkflowState(retry.runId());
            loop.setLastResult(run);

            if (run.state() == WorkflowState.COMPLETED) {
                store.appendLog(logId, "retry_succeeded:" + retry.runId());
                if (history != null) {
                    history.recordWorkflowEvent(retry.runId(), "WORKFLOW_COMPLETE", Map.of("attempt", attempt));
                }
                return;
            }

            Throwable failure = retry.failure() != null
                    ? retry.failure()
                    : new WorkflowException(null, run.error() != null ? run.error() : "run ended in " + run.state());
            noteFailingTool(failure, loop);
            ErrorClass errorClass = classifier.classify(failure, null);
            store.appendLog(logId, "error:" + errorClass);
            if (history != null) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("error_class", errorClass.name());
                if (loop.metadata().get("tool") != null) {
                    metadata.put("tool", loop.metadata().get("tool"));
                }
                history.recordErrorEvent(retry.runId(), String.valueOf(failure.getMessage()), metadata);
            }

            CorrectionAction action = applyStrategy(errorClass, loop, policy);
            if (action.type() == CorrectionAction.ActionType.RETRY
                    || action.type() == CorrectionAction.ActionType.ENSEMBLE_SELECT) {
                loop.mergeMetadata(action.contextUpdates());
            }
            if (errorClass == ErrorClass.PERMANENT) {
                log.info("Permanent failure on attempt {}; giving up", attempt);
                break;
            }
        }
    }

    // ------------------------------------------------------------------
    // Critics and strategies
    // ------------------------------------------------------------------

    public CriticResult handleStepResult(Object output) {
        return handleStepResult(output, defaultPolicy);
    }

    /**
     * Run the policy's critics over a step output and combine their verdicts:
     * mean score, all labels, all reasons. Unknown critic names are skipped.
     */
    public CriticResult handleStepResult(Object output, AgentPolicy policy) {
        List<CriticResult> outcomes = new ArrayList<>();
        for (String name : policyEngine.chooseCritics((Step) null, null, policy)) {
            Optional<Critic> critic = criticRegistry.find(name);
            if (critic.isEmpty()) {
                log.debug("Skipping unknown critic '{}'", name);
                continue;
            }
            outcomes.add(criticRegistry.evaluate(critic.get(), output));
        }
        if (outcomes.isEmpty()) {
            return CriticResult.of(1.0, "pass", "no critics configured");
        }
        double mean = outcomes.stream().mapToDouble(CriticResult::score).average().orElse(1.0);
        List<String> labels  = outcomes.stream().flatMap(c -> c.labels().stream()).toList();
        List<String> reasons = outcomes.stream().flatMap(c -> c.reasons().stream()).toList();
        return new CriticResult(mean, labels, reasons);
    }

    public CorrectionAction applyStrategy(ErrorClass errorClass, LoopContext loop) {
        return applyStrategy(errorClass, loop, defaultPolicy);
    }

    public CorrectionAction applyStrategy(ErrorClass errorClass, LoopContext loop, AgentPolicy policy) {
        Strategy strategy = policyEngine.chooseStrategy(errorClass, loop, policy, history);
        store.appendLog(loop.originalRunId(), "strategy:" + strategy.wireName());
        if (history != null) {
            history.recordAgentDecision(loop.workflowId(), strategy.wireName(),
                    Map.of("error_class", errorClass.name(), "attempt", loop.attempts()));
        }

        Map<String, Object> hints = loop.metadata();
        return switch (strategy) {
            case RETRY_SAME_TOOL            -> strategies.retrySameTool(hints);
            case RETRY_WITH_ALTERNATE_MODEL -> strategies.retryWithAlternateModel(hints, policy);
            case ROUTE_TO_ALTERNATE_TOOL    -> strategies.routeToAlternateTool(query(loop), hints, policy);
            case ESCALATE_TO_HUMAN_FLAG     -> {
                if (history != null) {
                    history.recordErrorEvent(loop.workflowId(), "escalated", Map.of());
                }
                yield strategies.escalateToHuman("policy escalation");
            }
            case ENSEMBLE -> policy.useEnsembleForCriticalTasks()
                    ? strategies.ensemble(query(loop), hints, policy)
                    : strategies.runCorrectionSubworkflow(hints);
            case RUN_CORRECTION_SUBWORKFLOW -> strategies.runCorrectionSubworkflow(hints);
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Copy a finished local run into the store so it can be read back like a
     * distributed one. Steps that ran are recorded COMPLETED with their
     * outputs; the failing step, if any, is recorded FAILED.
     */
    private String materialize(Workflow workflow, Map<String, Object> base, Submission local) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("distributed", false);
        metadata.put("local_run_id", local.runId());
        String runId = store.createWorkflowRun(workflow.toDefinition(), base, metadata);
        Map<String, Object> outputs = local.outputs();

        if (!local.failed()) {
            store.updateWorkflowState(runId, WorkflowState.RUNNING, null);
            for (Step step : workflow.steps()) {
                recordLocalSuccess(runId, step.name(), outputs.get(step.name()));
            }
            store.updateWorkflowState(runId, WorkflowState.COMPLETED, null);
            return runId;
        }

        String failingStep = local.failure() instanceof WorkflowException e ? e.getStepName() : null;
        if (failingStep != null) {
            for (Step step : workflow.steps()) {
                if (step.name().equals(failingStep)) {
                    store.updateStepState(runId, step.name(), WorkflowState.FAILED, null, rootMessage(local.failure()));
                    break;
                }
                recordLocalSuccess(runId, step.name(), outputs.get(step.name()));
            }
        }
        store.updateWorkflowState(runId, WorkflowState.FAILED, local.failure().getMessage());
        return runId;
    }

    private void recordLocalSuccess(String runId, String stepName, Object output) {
        store.updateStepState(runId, stepName, WorkflowState.RUNNING, null, null);
        store.putContextValue(runId, stepName, output);
        store.updateStepState(runId, stepName, WorkflowState.COMPLETED, output, null);
    }

    private static Map<String, Object> seedHints(Map<String, Object> base, boolean distributed) {
        Map<String, Object> hints = new LinkedHashMap<>();
        hints.put("distributed", distributed);
        for (String key : HINT_KEYS) {
            if (base.get(key) != null) {
                hints.put(key, base.get(key));
            }
        }
        return hints;
    }

    private static void noteFailingTool(Throwable failure, LoopContext loop) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ToolException toolFailure) {
                loop.metadata().put("tool", toolFailure.getToolName());
                return;
            }
            if (t.getCause() == t) return;
        }
    }

    private static String query(LoopContext loop) {
        String query = loop.metadataString("last_query");
        if (query == null) {
            query = loop.metadataString("task_type");
        }
        return query == null ? "" : query;
    }

    private static String rootMessage(Throwable failure) {
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
