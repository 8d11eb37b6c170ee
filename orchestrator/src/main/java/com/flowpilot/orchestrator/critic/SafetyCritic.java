package com.flowpilot.orchestrator.critic;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/** Flags outputs containing destructive shell or SQL fragments. */
@Component
public class SafetyCritic implements Critic {

    private static final List<String> UNSAFE_MARKERS = List.of("rm -rf", "drop table", "shutdown");

    @Override public String name() { return "safety"; }

    @Override
    public CriticResult evaluate(Object output) {
        String text = output == null ? "" : output.toString().toLowerCase(Locale.ROOT);
        for (String marker : UNSAFE_MARKERS) {
            if (text.contains(marker)) {
                return CriticResult.of(0.0, "unsafe", "unsafe pattern detected: " + marker);
            }
        }
        return CriticResult.of(1.0, "safe", "no unsafe markers");
    }
}
