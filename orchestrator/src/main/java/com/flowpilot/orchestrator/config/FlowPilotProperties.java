package com.flowpilot.orchestrator.config;

import com.flowpilot.orchestrator.agent.AgentPolicy;
import com.flowpilot.orchestrator.capability.Capability;
import com.flowpilot.orchestrator.llm.ModelConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration, bound from the {@code flowpilot.*} namespace in
 * {@code application.yml}.
 *
 * @param checkpoint   which checkpoint store backs runs
 * @param runner       distributed runner sizing
 * @param worker       background worker loop
 * @param workflows    where workflow files are loaded from
 * @param policy       default agent policy for self-correction sessions
 * @param models       models the selector may choose from
 * @param capabilities capability catalog; empty derives one entry per registered tool
 * @param critics      critic settings
 * @param history      in-memory history retention
 */
@ConfigurationProperties(prefix = "flowpilot")
public record FlowPilotProperties(
        @DefaultValue Checkpoint          checkpoint,
        @DefaultValue Runner              runner,
        @DefaultValue WorkerLoop          worker,
        @DefaultValue Workflows           workflows,
        @DefaultValue Policy              policy,
        List<Model>                       models,
        List<CapabilityEntry>             capabilities,
        @DefaultValue Critics             critics,
        @DefaultValue History             history) {

    /** @param backend {@code jdbc} (durable, default) or {@code memory} */
    public record Checkpoint(@DefaultValue("jdbc") String backend) {}

    /**
     * @param maxParallel in-flight steps per run
     * @param stepThreads dispatch pool size, and warm threads kept by the timed-step pool
     */
    public record Runner(@DefaultValue("4") int maxParallel, @DefaultValue("8") int stepThreads) {}

    /** @param pollInterval delay between worker ticks */
    public record WorkerLoop(boolean enabled, @DefaultValue("PT2S") Duration pollInterval) {}

    /** @param maxRecords oldest records are evicted beyond this count */
    public record History(@DefaultValue("10000") int maxRecords) {}

    public record Workflows(@DefaultValue("workflows") String dir) {}

    public record Policy(
            @DefaultValue("1") int maxRetries,
            @DefaultValue("1") int maxCorrections,
            List<String>         allowedModels,
            List<String>         preferredModelTags,
            List<String>         forbiddenModels,
            Double               maxLatencyHint,
            boolean              useEnsembleForCriticalTasks,
            List<String>         preferredCapabilityTags,
            List<String>         preferredTools,
            Map<String, Integer> escalationThresholds,
            List<String>         criticsToRun) {

        public AgentPolicy toAgentPolicy() {
            return new AgentPolicy(maxRetries, maxCorrections, allowedModels, preferredModelTags,
                    forbiddenModels, maxLatencyHint, useEnsembleForCriticalTasks, preferredCapabilityTags,
                    preferredTools, escalationThresholds, criticsToRun);
        }
    }

    public record Model(
            String       id,
            String       provider,
            List<String> tags,
            double       costHint,
            double       latencyHint,
            @DefaultValue("true") boolean enabled) {

        public ModelConfig toModelConfig() {
            return new ModelConfig(id, provider, tags, costHint, latencyHint, enabled);
        }
    }

    public record CapabilityEntry(String id, String name, String description, List<String> tags, String tool) {

        public Capability toCapability() {
            return new Capability(id, name != null ? name : id, description, tags, tool);
        }
    }

    /** @param requiredKeys keys the structure critic expects in map outputs */
    public record Critics(List<String> requiredKeys) {}

    public List<Model> models() {
        return models == null ? List.of() : models;
    }

    public List<CapabilityEntry> capabilities() {
        return capabilities == null ? List.of() : capabilities;
    }
}
