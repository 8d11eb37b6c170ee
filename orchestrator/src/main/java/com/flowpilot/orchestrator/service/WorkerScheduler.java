package com.flowpilot.orchestrator.service;

import com.flowpilot.orchestrator.config.FlowPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Drives the {@link Worker} from Spring's scheduler when
 * {@code flowpilot.worker.enabled=true}, every {@code flowpilot.worker.poll-interval}.
 *
 * Fixed delay waits one poll interval after each tick finishes. A tick keeps
 * calling runOnce() while it finds work, so a backlog drains without waiting
 * a full interval per step.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "flowpilot.worker", name = "enabled", havingValue = "true")
public class WorkerScheduler implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WorkerScheduler.class);

    // Upper bound per tick so one busy store cannot starve the scheduler thread.
    static final int MAX_STEPS_PER_TICK = 100;

    private final Worker              worker;
    private final FlowPilotProperties properties;

    public WorkerScheduler(Worker worker, FlowPilotProperties properties) {
        this.worker     = worker;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration pollInterval = properties.worker().pollInterval();
        log.info("Worker scheduled every {} ms", pollInterval.toMillis());
        registrar.addFixedDelayTask(this::tick, pollInterval);
    }

    public void tick() {
        int advanced = 0;
        try {
            while (advanced < MAX_STEPS_PER_TICK && worker.runOnce()) {
                advanced++;
            }
        } catch (RuntimeException e) {
            log.error("Worker tick failed after {} steps: {}", advanced, e.getMessage(), e);
        }
        if (advanced > 0) {
            log.debug("Worker tick advanced {} steps", advanced);
        }
    }
}
