package com.flowpilot.orchestrator.critic;

import org.springframework.stereotype.Component;

/** Passes any non-empty output. */
@Component
public class QualityCritic implements Critic {

    public static final String NAME = "quality";

    @Override public String name() { return NAME; }

    @Override
    public CriticResult evaluate(Object output) {
        String text = output == null ? "" : output.toString();
        return text.isEmpty()
                ? CriticResult.of(0.0, "missing", "no output produced")
                : CriticResult.of(1.0, "complete", "output present");
    }
}
