package com.flowpilot.orchestrator.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a strategy decided to do next.
 *
 * @param contextUpdates hints merged into the loop metadata before the next attempt
 * @param model          chosen model, for ENSEMBLE_SELECT
 * @param result         best output, for ENSEMBLE_SELECT
 * @param score          quality score of {@code result}, for ENSEMBLE_SELECT
 */
public record CorrectionAction(
        Strategy            strategy,
        ActionType          type,
        Map<String, Object> contextUpdates,
        String              reason,
        String              model,
        Object              result,
        Double              score
) {
    public enum ActionType { RETRY, ESCALATE, SUBWORKFLOW, ENSEMBLE_SELECT, NONE }

    public CorrectionAction {
        contextUpdates = contextUpdates == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contextUpdates));
    }

    static CorrectionAction retry(Strategy strategy, Map<String, Object> updates) {
        return new CorrectionAction(strategy, ActionType.RETRY, updates, null, null, null, null);
    }
}
