package com.flowpilot.orchestrator.critic;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named critics, evaluated with metrics.
 *
 * <pre>
 *   flowpilot.critic.evaluations{critic, verdict="pass|fail|error"}
 *   flowpilot.critic.duration{critic}
 * </pre>
 * A critic that throws scores 0.0 instead of failing the caller.
 */
public class CriticRegistry {

    private static final Logger log = LoggerFactory.getLogger(CriticRegistry.class);

    /** Scores at or above this count as a pass in the metrics. */
    static final double PASS_SCORE = 0.5;

    private final Map<String, Critic> critics = new ConcurrentHashMap<>();
    private final MeterRegistry       meterRegistry;

    public CriticRegistry(List<Critic> allCritics, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Critic critic : allCritics) {
            critics.put(critic.name(), critic);
            log.info("Registered critic '{}'", critic.name());
        }
    }

    public Optional<Critic> find(String name) {
        return Optional.ofNullable(critics.get(name));
    }

    public List<String> criticNames() {
        return critics.keySet().stream().sorted().toList();
    }

    public CriticResult evaluate(Critic critic, Object output) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String verdict = "error";
        try {
            CriticResult result = critic.evaluate(output);
            verdict = result.score() >= PASS_SCORE ? "pass" : "fail";
            return result;
        } catch (RuntimeException e) {
            log.warn("Critic '{}' threw: {}", critic.name(), e.getMessage());
            return CriticResult.of(0.0, "critic_error", critic.name() + ": " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("flowpilot.critic.duration", "critic", critic.name()));
            meterRegistry.counter("flowpilot.critic.evaluations",
                    "critic", critic.name(), "verdict", verdict).increment();
        }
    }
}
