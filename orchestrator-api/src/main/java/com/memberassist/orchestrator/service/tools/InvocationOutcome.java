package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.model.ToolResult;
import com.memberassist.orchestrator.service.fallback.FallbackReason;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param failureReason {@code null} when every tool of the plan succeeded
 */
public record InvocationOutcome(List<ToolResult> results,
                                Map<String, Object> executionContext,
                                InvocationPhase phase,
                                FallbackReason failureReason) {

    public InvocationOutcome {
        results = results == null ? List.of() : List.copyOf(results);
        executionContext = executionContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(executionContext));
    }

    public boolean succeeded() {
        return phase == InvocationPhase.SUCCEEDED;
    }

    public int totalAttempts() {
        return results.stream().mapToInt(ToolResult::attempts).sum();
    }
}
