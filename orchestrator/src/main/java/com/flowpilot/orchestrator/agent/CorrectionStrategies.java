package com.flowpilot.orchestrator.agent;

import com.flowpilot.orchestrator.agent.CorrectionAction.ActionType;
import com.flowpilot.orchestrator.capability.Capability;
import com.flowpilot.orchestrator.capability.CapabilityResolver;
import com.flowpilot.orchestrator.critic.Critic;
import com.flowpilot.orchestrator.critic.CriticRegistry;
import com.flowpilot.orchestrator.critic.CriticResult;
import com.flowpilot.orchestrator.critic.QualityCritic;
import com.flowpilot.orchestrator.llm.ModelProvider;
import com.flowpilot.orchestrator.llm.ModelSelector;
import com.flowpilot.orchestrator.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The concrete correction moves behind each {@link Strategy}.
 *
 * None of these re-run the workflow; they only compute the hints (model,
 * tool, escalation reason) the agent loop applies to its next attempt.
 */
public class CorrectionStrategies {

    private static final Logger log = LoggerFactory.getLogger(CorrectionStrategies.class);

    static final String DEFAULT_TASK_TYPE = "generic";

    private final ModelSelector      modelSelector;
    private final CapabilityResolver capabilityResolver;
    private final ToolRegistry       toolRegistry;
    private final ModelProvider      modelProvider;
    private final CriticRegistry     criticRegistry;
    private final Executor           ensembleExecutor;

    public CorrectionStrategies(ModelSelector modelSelector,
                                CapabilityResolver capabilityResolver,
                                ToolRegistry toolRegistry,
                                ModelProvider modelProvider,
                                CriticRegistry criticRegistry,
                                Executor ensembleExecutor) {
        this.modelSelector      = modelSelector;
        this.capabilityResolver = capabilityResolver;
        this.toolRegistry       = toolRegistry;
        this.modelProvider      = modelProvider;
        this.criticRegistry     = criticRegistry;
        this.ensembleExecutor   = ensembleExecutor;
    }

    public CorrectionAction retrySameTool(Map<String, Object> metadata) {
        return CorrectionAction.retry(Strategy.RETRY_SAME_TOOL, metadata);
    }

    /**
     * Ask the selector for a model under the policy; without a selector (or
     * with nothing eligible) fall back to the first allowed model.
     */
    public CorrectionAction retryWithAlternateModel(Map<String, Object> metadata, AgentPolicy policy) {
        String taskType = taskType(metadata);
        String model = null;
        if (modelSelector != null) {
            model = modelSelector.selectModel(taskType, policy, metadata).orElse(null);
        }
        if (model == null && !policy.allowedModels().isEmpty()) {
            model = policy.allowedModels().get(0);
        }
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("force_model", model);
        return CorrectionAction.retry(Strategy.RETRY_WITH_ALTERNATE_MODEL, updates);
    }

    /**
     * Capability catalog first, then keyword routing over registered tools,
     * then the policy's first preferred tool.
     */
    public CorrectionAction routeToAlternateTool(String query, Map<String, Object> metadata, AgentPolicy policy) {
        String tool = null;
        if (capabilityResolver != null) {
            tool = capabilityResolver.findToolsForTask(query, metadata, policy).stream()
                    .map(Capability::toolName)
                    .findFirst()
                    .orElse(null);
        }
        if (tool == null && toolRegistry != null) {
            tool = toolRegistry.route(query).orElse(null);
        }
        if (tool == null && !policy.preferredTools().isEmpty()) {
            tool = policy.preferredTools().get(0);
        }
        log.debug("Alternate tool for '{}': {}", query, tool);
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("tool", tool);
        return CorrectionAction.retry(Strategy.ROUTE_TO_ALTERNATE_TOOL, updates);
    }

    public CorrectionAction escalateToHuman(String reason) {
        return new CorrectionAction(Strategy.ESCALATE_TO_HUMAN_FLAG, ActionType.ESCALATE,
                Map.of(), reason, null, null, null);
    }

    public CorrectionAction runCorrectionSubworkflow(Map<String, Object> metadata) {
        return new CorrectionAction(Strategy.RUN_CORRECTION_SUBWORKFLOW, ActionType.SUBWORKFLOW,
                metadata, null, null, null, null);
    }

    /**
     * Generate with up to two fallback models concurrently and keep the
     * output the quality critic scores highest. Providers that fail are
     * left out of the comparison.
     */
    public CorrectionAction ensemble(String task, Map<String, Object> metadata, AgentPolicy policy) {
        List<String> models = modelSelector == null
                ? List.of()
                : modelSelector.selectFallbackModels(taskType(metadata), policy, metadata);
        List<String> chosen = models.size() > 2 ? models.subList(0, 2) : models;
        if (chosen.isEmpty()) {
            return new CorrectionAction(Strategy.ENSEMBLE, ActionType.NONE, Map.of(),
                    "no models available for ensemble", null, null, null);
        }

        List<CompletableFuture<Candidate>> futures = new ArrayList<>();
        for (String model : chosen) {
            futures.add(CompletableFuture.supplyAsync(() -> generate(model, task), ensembleExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Optional<Candidate> best = futures.stream()
                .map(CompletableFuture::join)
                .filter(c -> c.output() != null)
                .max(Comparator.comparingDouble(Candidate::score));
        if (best.isEmpty()) {
            return new CorrectionAction(Strategy.ENSEMBLE, ActionType.NONE, Map.of(),
                    "every ensemble model failed", null, null, null);
        }
        Candidate winner = best.get();
        log.info("Ensemble picked model '{}' (score {})", winner.model(), winner.score());
        return new CorrectionAction(Strategy.ENSEMBLE, ActionType.ENSEMBLE_SELECT,
                Map.of("force_model", winner.model()), null, winner.model(), winner.output(), winner.score());
    }

    private Candidate generate(String model, String task) {
        try {
            String output = modelProvider.generate(model, task);
            CriticResult verdict = criticRegistry.evaluate(qualityCritic(), output);
            return new Candidate(model, output, verdict.score());
        } catch (RuntimeException e) {
            log.warn("Ensemble model '{}' failed: {}", model, e.getMessage());
            return new Candidate(model, null, 0.0);
        }
    }

    private Critic qualityCritic() {
        return criticRegistry.find(QualityCritic.NAME).orElseGet(QualityCritic::new);
    }

    private static String taskType(Map<String, Object> metadata) {
        Object value = metadata == null ? null : metadata.get("task_type");
        return value == null ? DEFAULT_TASK_TYPE : value.toString();
    }

    private record Candidate(String model, String output, double score) {}
}
