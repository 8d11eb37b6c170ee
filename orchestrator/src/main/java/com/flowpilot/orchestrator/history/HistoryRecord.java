package com.flowpilot.orchestrator.history;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One remembered event.
 *
 * @param type   e.g. {@code WORKFLOW_START}, {@code STEP_SUCCESS}, {@code ERROR}, {@code AGENT_DECISION}
 * @param source who recorded it: {@code workflow} or {@code agent}
 * @param tags   lookup keys such as {@code tool:trello_fetch_board}
 */
public record HistoryRecord(
        String              id,
        String              type,
        String              source,
        Map<String, Object> payload,
        List<String>        tags,
        Instant             recordedAt
) {
    public HistoryRecord {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        tags    = tags == null ? List.of() : List.copyOf(tags);
    }
}
