package com.flowpilot.orchestrator.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flowpilot.orchestrator.tool.ToolRunner;
import com.flowpilot.orchestrator.tool.ToolStepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link Workflow}s from the YAML/JSON workflow DSL.
 *
 * <pre>
 * name: nightly-sync
 * steps:
 *   - name: fetch
 *     action: tool:trello_fetch_board
 *     timeout: 30          # seconds
 *   - name: flag
 *     action: set:mode=full
 *   - name: notify
 *     when: fetch          # runs only if context["fetch"] is truthy
 *     action: noop
 *   - name: route
 *     switch: mode         # looks up context["mode"] in cases
 *     cases:
 *       full: set:route=all
 *       delta: noop
 * </pre>
 *
 * Supported actions: {@code noop}, {@code set:key=value} and
 * {@code tool:name}. Anything else is a {@link WorkflowDefinitionException}.
 * YAML is a superset of JSON, so one mapper reads both.
 */
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final ToolRunner   toolRunner;
    private final Path         baseDir;

    /**
     * @param toolRunner runs {@code tool:} actions; null rejects them
     * @param baseDir    directory that relative references resolve against and
     *                   that every referenced file must live under; null allows any path
     */
    public WorkflowLoader(ToolRunner toolRunner, Path baseDir) {
        this.toolRunner = toolRunner;
        this.baseDir    = baseDir == null ? null : baseDir.toAbsolutePath().normalize();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Load a workflow file named relative to the base directory. */
    public Workflow load(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new WorkflowDefinitionException("Workflow reference must not be blank");
        }
        return load(resolve(reference));
    }

    public Workflow load(Path path) {
        JsonNode tree;
        try {
            tree = yaml.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new WorkflowDefinitionException("Cannot read workflow file " + path + ": " + e.getMessage(), e);
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        log.info("Loading workflow from {}", path);
        return fromTree(tree, dot > 0 ? fileName.substring(0, dot) : fileName);
    }

    /** Build a workflow from an already-parsed definition (e.g. an HTTP request body). */
    public Workflow fromTree(JsonNode tree) {
        return fromTree(tree, "inline");
    }

    private Workflow fromTree(JsonNode tree, String fallbackName) {
        if (tree == null || !tree.isObject()) {
            throw new WorkflowDefinitionException("Workflow definition must be an object with a 'steps' list");
        }
        WorkflowDocument doc;
        try {
            doc = yaml.treeToValue(tree, WorkflowDocument.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new WorkflowDefinitionException("Malformed workflow definition: " + e.getMessage(), e);
        }
        String name = doc.name() != null && !doc.name().isBlank() ? doc.name() : fallbackName;
        List<Step> steps = new ArrayList<>();
        for (StepDocument stepDoc : doc.steps() == null ? List.<StepDocument>of() : doc.steps()) {
            steps.add(buildStep(stepDoc));
        }
        return Workflow.builder(name).steps(steps).build();
    }

    // ------------------------------------------------------------------
    // Step construction
    // ------------------------------------------------------------------

    private Step buildStep(StepDocument doc) {
        if (doc == null || doc.name() == null || doc.name().isBlank()) {
            throw new WorkflowDefinitionException("Every step needs a name");
        }
        Duration timeout = doc.timeout() == null ? null : Duration.ofMillis(Math.round(doc.timeout() * 1000));

        if (doc.when() != null) {
            String key = doc.when();
            return new ConditionalStep(doc.name(), buildAction(doc.action()),
                    ctx -> isTruthy(ctx.get(key)), timeout);
        }
        if (doc.switchKey() != null) {
            String key = doc.switchKey();
            Map<String, StepAction> cases = new LinkedHashMap<>();
            if (doc.cases() != null) {
                doc.cases().forEach((caseKey, action) -> cases.put(caseKey, buildAction(action)));
            }
            return new BranchStep(doc.name(), ctx -> ctx.get(key, ""), cases, timeout);
        }
        return new Step(doc.name(), buildAction(doc.action()), timeout);
    }

    private StepAction buildAction(String action) {
        if (action == null || action.equals("noop")) {
            return StepAction.noop();
        }
        if (action.startsWith("set:")) {
            String assignment = action.substring("set:".length());
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new WorkflowDefinitionException("Expected set:key=value but got: " + action);
            }
            String key   = assignment.substring(0, eq);
            String value = assignment.substring(eq + 1);
            return ctx -> {
                ctx.put(key, value);
                return value;
            };
        }
        if (action.startsWith("tool:")) {
            if (toolRunner == null) {
                throw new WorkflowDefinitionException("Tool actions are not available: " + action);
            }
            return new ToolStepAction(toolRunner, action.substring("tool:".length()));
        }
        throw new WorkflowDefinitionException("Unsupported action: " + action);
    }

    private Path resolve(String reference) {
        if (baseDir == null) {
            return Path.of(reference);
        }
        Path resolved = baseDir.resolve(reference).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new WorkflowDefinitionException("Workflow reference escapes the workflow directory: " + reference);
        }
        return resolved;
    }

    private static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof java.util.Collection<?> c) return !c.isEmpty();
        return true;
    }

    // ------------------------------------------------------------------
    // DSL document shape
    // ------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkflowDocument(String name, List<StepDocument> steps) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StepDocument(
            String name,
            String action,
            String when,
            @JsonProperty("switch") String switchKey,
            Map<String, String> cases,
            Double timeout) {}
}
