package com.flowpilot.orchestrator.tool;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry and the default {@link ToolRunner}.
 *
 * <p>Every call goes through {@link #execute}, which times and counts it:
 * <pre>
 *   flowpilot.tool.calls{tool, status="success|error"}
 *   flowpilot.tool.duration{tool}
 * </pre>
 * A tool that throws is reported as a failed {@link ToolResult}; only an
 * unknown tool name escapes as an exception.
 */
public class ToolRegistry implements ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry     meterRegistry;

    public ToolRegistry(List<Tool> allTools, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Tool tool : allTools) {
            register(tool);
        }
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
        log.info("Registered tool '{}'", tool.name());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Tool get(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    /** Returns all registered tool names (sorted). */
    public List<String> toolNames() {
        return tools.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    @Override
    public ToolResult execute(String name, Map<String, Object> params) {
        Tool tool = get(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return ToolResult.ok(tool.execute(params == null ? Map.of() : params));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "error";
            return ToolResult.error("interrupted");
        } catch (Exception e) {
            status = "error";
            log.warn("Tool '{}' failed: {}", name, e.getMessage());
            return ToolResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            sample.stop(meterRegistry.timer("flowpilot.tool.duration", "tool", name));
            meterRegistry.counter("flowpilot.tool.calls", "tool", name, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Keyword routing
    // ------------------------------------------------------------------

    /**
     * Pick the tool whose name and description best match a free-text query.
     *
     * Each query word scores 2 when it appears in the tool name and 1 when it
     * appears in the description. Ties go to the alphabetically first tool.
     *
     * @return the best match, or empty when no word matches any tool
     */
    public Optional<String> route(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String[] words = normalize(query).split("\\s+");
        String best = null;
        int bestScore = 0;
        for (String name : toolNames()) {
            String normalizedName = normalize(name.replace('_', ' '));
            String normalizedDesc = normalize(tools.get(name).description());
            int score = 0;
            for (String word : words) {
                if (word.isEmpty()) continue;
                if (normalizedName.contains(word)) score += 2;
                if (normalizedDesc.contains(word)) score += 1;
            }
            if (score > bestScore) {
                best = name;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Routed query '{}' to tool '{}' (score {})", query, best, bestScore);
        }
        return Optional.ofNullable(best);
    }

    private static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9 ]+", "");
    }
}
