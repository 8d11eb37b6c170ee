package com.flowpilot.orchestrator.agent;

/**
 * Coarse failure categories that drive the choice of correction strategy.
 */
public enum ErrorClass {
    /** Timeouts and connectivity; worth retrying as is. */
    TRANSIENT,
    /** Nothing a retry or reroute is expected to fix. */
    PERMANENT,
    /** Bad parameters, missing keys, unknown tool. */
    TOOL_CONFIG,
    /** The step ran but its output scored poorly. */
    MODEL_QUALITY,
    /** Needs a person: permissions, approvals. */
    REQUIRES_HUMAN
}
