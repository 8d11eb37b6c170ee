package com.flowpilot.orchestrator.tool;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns its parameters unchanged. Handy for smoke-testing workflow files
 * without any external service.
 */
@Component
public class EchoTool implements Tool {

    @Override public String name()        { return "echo"; }
    @Override public String description() { return "Echo the input parameters back as the result"; }

    @Override
    public Object execute(Map<String, Object> params) {
        return new LinkedHashMap<>(params);
    }
}
