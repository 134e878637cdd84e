package com.memberassist.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvocationResponse(
        String sessionId,
        List<SelectedTool> selectedTool,
        double confidence,
        String responseText,
        String route,
        String reasonCode,
        boolean success,
        long processingTimeMs,
        OffsetDateTime timestamp,
        List<String> validationErrors
) {
    public static InvocationResponse rejected(String sessionId, String responseText, List<String> validationErrors) {
        return new InvocationResponse(sessionId, List.of(), 0.0, responseText, null, "invalid_request",
                false, 0L, OffsetDateTime.now(), List.copyOf(validationErrors));
    }
}
