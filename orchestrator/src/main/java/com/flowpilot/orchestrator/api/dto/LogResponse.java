package com.flowpilot.orchestrator.api.dto;

import java.util.List;

/** Response body for GET /jobs/{id}/log. */
public record LogResponse(String id, List<String> logs) {}
