package com.flowpilot.orchestrator.agent;

import com.flowpilot.orchestrator.history.HistoryStore;
import com.flowpilot.orchestrator.workflow.Context;
import com.flowpilot.orchestrator.workflow.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Stateless rules that turn an error class into a correction strategy.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    /**
     * @param history optional; when present, a tool that keeps failing is
     *                treated as a model problem rather than rerouted again
     */
    public Strategy chooseStrategy(ErrorClass errorClass, LoopContext loop, AgentPolicy policy, HistoryStore history) {
        if (errorClass == ErrorClass.TOOL_CONFIG && history != null) {
            int threshold = policy.toolFailureThreshold();
            String tool = loop.metadataString("tool");
            int failures = history.recentFailuresForTool(tool == null ? "" : tool, threshold).size();
            if (failures >= threshold) {
                log.info("Tool '{}' failed {} times recently; switching model instead of tool", tool, failures);
                return Strategy.RETRY_WITH_ALTERNATE_MODEL;
            }
        }
        if (errorClass == ErrorClass.MODEL_QUALITY
                && policy.useEnsembleForCriticalTasks()
                && isCritical(loop)) {
            return Strategy.ENSEMBLE;
        }
        return switch (errorClass) {
            case TRANSIENT      -> Strategy.RETRY_SAME_TOOL;
            case MODEL_QUALITY  -> Strategy.RETRY_WITH_ALTERNATE_MODEL;
            case TOOL_CONFIG    -> Strategy.ROUTE_TO_ALTERNATE_TOOL;
            case REQUIRES_HUMAN -> Strategy.ESCALATE_TO_HUMAN_FLAG;
            case PERMANENT      -> Strategy.RUN_CORRECTION_SUBWORKFLOW;
        };
    }

    /** Critic names to evaluate for a step's output. Currently the policy's list for every step. */
    public List<String> chooseCritics(Step step, Context context, AgentPolicy policy) {
        return policy.criticsToRun();
    }

    public boolean shouldEscalate(LoopContext loop, AgentPolicy policy) {
        return loop.attempts() >= policy.maxCorrections();
    }

    private static boolean isCritical(LoopContext loop) {
        Object flag = loop.metadata().get("critical");
        return flag instanceof Boolean b ? b : flag != null && Boolean.parseBoolean(flag.toString());
    }
}
