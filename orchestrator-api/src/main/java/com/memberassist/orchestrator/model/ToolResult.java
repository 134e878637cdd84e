package com.memberassist.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolResult(
        String toolName,
        boolean success,
        Map<String, Object> payload,
        String error,
        int attempts
) {
    public ToolResult {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static ToolResult success(String toolName, Map<String, Object> payload, int attempts) {
        return new ToolResult(toolName, true, payload, null, attempts);
    }

    public static ToolResult failure(String toolName, String error, int attempts) {
        return new ToolResult(toolName, false, Map.of(), error, attempts);
    }
}
