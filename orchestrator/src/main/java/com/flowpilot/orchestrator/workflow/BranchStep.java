package com.flowpilot.orchestrator.workflow;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A step that selects one of several actions.
 *
 * The selector's value is converted to a lower-case string and looked up in
 * the case table, whose keys are lower-cased at construction. A value with no
 * matching case fails the step.
 */
public class BranchStep extends Step {

    private final Function<Context, ?>    selector;
    private final Map<String, StepAction> cases;

    public BranchStep(String name, Function<Context, ?> selector, Map<String, StepAction> cases) {
        this(name, selector, cases, null);
    }

    public BranchStep(String name, Function<Context, ?> selector, Map<String, StepAction> cases, Duration timeout) {
        super(name, StepAction.noop(), timeout);
        this.selector = Objects.requireNonNull(selector, "selector");
        Map<String, StepAction> normalized = new LinkedHashMap<>();
        cases.forEach((key, action) -> normalized.put(normalize(key), action));
        this.cases = Map.copyOf(normalized);
    }

    @Override
    public StepType type() {
        return StepType.BRANCH;
    }

    @Override
    protected Object invoke(Context context) throws Exception {
        String key = normalize(selector.apply(context));
        StepAction action = cases.get(key);
        if (action == null) {
            throw new WorkflowException(name(), "No case for key '" + key + "'");
        }
        return action.execute(context);
    }

    private static String normalize(Object key) {
        return String.valueOf(key).toLowerCase(Locale.ROOT);
    }
}
