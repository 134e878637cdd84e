package com.memberassist.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SelectedTool(
        String toolName,
        double confidence,
        String reasoning,
        Map<String, Object> parameters,
        String dependsOn,
        List<String> contextNeeded
) {
    public SelectedTool {
        reasoning = reasoning == null ? "" : reasoning;
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        contextNeeded = contextNeeded == null ? List.of() : List.copyOf(contextNeeded);
    }

    public static SelectedTool of(String toolName, double confidence, String reasoning) {
        return new SelectedTool(toolName, confidence, reasoning, Map.of(), null, List.of());
    }

    @JsonIgnore
    public CandidateKind kind() {
        return CandidateKind.of(toolName);
    }
}
