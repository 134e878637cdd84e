package com.memberassist.orchestrator.service.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body sent to a tool endpoint.
 */
public record ToolCall(String query,
                       Map<String, String> callerContext,
                       Map<String, Object> executionContext,
                       Map<String, Object> parameters) {

    public ToolCall {
        callerContext = callerContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(callerContext));
        executionContext = executionContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(executionContext));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
