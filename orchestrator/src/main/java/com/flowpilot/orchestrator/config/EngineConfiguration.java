package com.flowpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.orchestrator.agent.AgentLoop;
import com.flowpilot.orchestrator.agent.CorrectionStrategies;
import com.flowpilot.orchestrator.agent.ErrorClassifier;
import com.flowpilot.orchestrator.agent.PolicyEngine;
import com.flowpilot.orchestrator.capability.Capability;
import com.flowpilot.orchestrator.capability.CapabilityResolver;
import com.flowpilot.orchestrator.capability.CatalogCapabilityResolver;
import com.flowpilot.orchestrator.checkpoint.BlobCodec;
import com.flowpilot.orchestrator.checkpoint.CheckpointStore;
import com.flowpilot.orchestrator.checkpoint.InMemoryCheckpointStore;
import com.flowpilot.orchestrator.checkpoint.JpaCheckpointStore;
import com.flowpilot.orchestrator.critic.Critic;
import com.flowpilot.orchestrator.critic.CriticRegistry;
import com.flowpilot.orchestrator.critic.StructureCritic;
import com.flowpilot.orchestrator.history.HistoryStore;
import com.flowpilot.orchestrator.history.InMemoryHistoryStore;
import com.flowpilot.orchestrator.llm.ModelProvider;
import com.flowpilot.orchestrator.llm.ModelSelector;
import com.flowpilot.orchestrator.llm.RegistryModelSelector;
import com.flowpilot.orchestrator.llm.SimulatedModelProvider;
import com.flowpilot.orchestrator.repository.StepRepository;
import com.flowpilot.orchestrator.repository.WorkflowLogRepository;
import com.flowpilot.orchestrator.repository.WorkflowRepository;
import com.flowpilot.orchestrator.service.DistributedRunner;
import com.flowpilot.orchestrator.service.Worker;
import com.flowpilot.orchestrator.tool.Tool;
import com.flowpilot.orchestrator.tool.ToolRegistry;
import com.flowpilot.orchestrator.workflow.StepExecutor;
import com.flowpilot.orchestrator.workflow.WorkflowLoader;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds every engine collaborator exactly once and hands them to each other
 * through constructors.
 *
 * Tools and critics declared as {@code @Component} are collected into their
 * registries; everything else is created here.
 */
@Configuration
@EnableConfigurationProperties(FlowPilotProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    // ------------------------------------------------------------------
    // Checkpoint store
    // ------------------------------------------------------------------

    @Bean
    BlobCodec blobCodec(ObjectMapper objectMapper) {
        return new BlobCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "flowpilot.checkpoint", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    CheckpointStore jpaCheckpointStore(WorkflowRepository workflows,
                                       StepRepository steps,
                                       WorkflowLogRepository logs,
                                       BlobCodec codec) {
        log.info("Using durable checkpoint store");
        return new JpaCheckpointStore(workflows, steps, logs, codec);
    }

    @Bean
    @ConditionalOnProperty(prefix = "flowpilot.checkpoint", name = "backend", havingValue = "memory")
    CheckpointStore inMemoryCheckpointStore() {
        log.info("Using in-memory checkpoint store; runs are lost on restart");
        return new InMemoryCheckpointStore();
    }

    @Bean
    HistoryStore historyStore(FlowPilotProperties properties) {
        return new InMemoryHistoryStore(properties.history().maxRecords());
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "close")
    StepExecutor stepExecutor(FlowPilotProperties properties) {
        return new StepExecutor(properties.runner().stepThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService stepDispatchPool(FlowPilotProperties properties) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("step-dispatch-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.runner().stepThreads(), factory);
    }

    @Bean
    DistributedRunner distributedRunner(CheckpointStore store,
                                        StepExecutor stepExecutor,
                                        @Qualifier("stepDispatchPool") ExecutorService dispatchPool,
                                        HistoryStore historyStore,
                                        MeterRegistry meterRegistry,
                                        FlowPilotProperties properties) {
        return new DistributedRunner(store, stepExecutor, dispatchPool,
                properties.runner().maxParallel(), historyStore, meterRegistry);
    }

    @Bean
    Worker worker(CheckpointStore store) {
        return new Worker(store);
    }

    // ------------------------------------------------------------------
    // Tools, critics, workflow files
    // ------------------------------------------------------------------

    @Bean
    ToolRegistry toolRegistry(List<Tool> tools, MeterRegistry meterRegistry) {
        return new ToolRegistry(tools, meterRegistry);
    }

    @Bean
    StructureCritic structureCritic(FlowPilotProperties properties) {
        return new StructureCritic(properties.critics().requiredKeys());
    }

    @Bean
    CriticRegistry criticRegistry(List<Critic> critics, MeterRegistry meterRegistry) {
        return new CriticRegistry(critics, meterRegistry);
    }

    @Bean
    WorkflowLoader workflowLoader(ToolRegistry toolRegistry, FlowPilotProperties properties) {
        return new WorkflowLoader(toolRegistry, Path.of(properties.workflows().dir()));
    }

    // ------------------------------------------------------------------
    // Self-correction
    // ------------------------------------------------------------------

    @Bean
    ModelSelector modelSelector(FlowPilotProperties properties) {
        return new RegistryModelSelector(properties.models().stream()
                .map(FlowPilotProperties.Model::toModelConfig)
                .toList());
    }

    @Bean
    @ConditionalOnMissingBean(ModelProvider.class)
    ModelProvider modelProvider() {
        return new SimulatedModelProvider();
    }

    @Bean
    CapabilityResolver capabilityResolver(FlowPilotProperties properties, List<Tool> tools) {
        List<Capability> catalog = properties.capabilities().isEmpty()
                ? tools.stream()
                        .map(t -> new Capability(t.name(), t.name(), t.description(), List.of(), t.name()))
                        .toList()
                : properties.capabilities().stream()
                        .map(FlowPilotProperties.CapabilityEntry::toCapability)
                        .toList();
        return new CatalogCapabilityResolver(catalog);
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService ensemblePool() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("ensemble-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(2, factory);
    }

    @Bean
    AgentLoop agentLoop(DistributedRunner runner,
                        ModelSelector modelSelector,
                        CapabilityResolver capabilityResolver,
                        ToolRegistry toolRegistry,
                        ModelProvider modelProvider,
                        CriticRegistry criticRegistry,
                        @Qualifier("ensemblePool") ExecutorService ensemblePool,
                        HistoryStore historyStore,
                        WorkflowLoader workflowLoader,
                        FlowPilotProperties properties) {
        CorrectionStrategies strategies = new CorrectionStrategies(modelSelector, capabilityResolver,
                toolRegistry, modelProvider, criticRegistry, ensemblePool);
        return new AgentLoop(runner, new ErrorClassifier(), new PolicyEngine(), strategies,
                criticRegistry, historyStore, workflowLoader, properties.policy().toAgentPolicy());
    }
}
