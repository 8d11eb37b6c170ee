package com.flowpilot.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Correction strategies the policy engine can pick. Wire names are the
 * ones written to run logs ({@code strategy:<name>}).
 */
public enum Strategy {
    RETRY_SAME_TOOL("retry_same_tool"),
    RETRY_WITH_ALTERNATE_MODEL("retry_with_alternate_model"),
    ROUTE_TO_ALTERNATE_TOOL("route_to_alternate_tool"),
    ESCALATE_TO_HUMAN_FLAG("escalate_to_human_flag"),
    ENSEMBLE("ensemble"),
    RUN_CORRECTION_SUBWORKFLOW("run_correction_subworkflow");

    private final String wireName;

    Strategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
