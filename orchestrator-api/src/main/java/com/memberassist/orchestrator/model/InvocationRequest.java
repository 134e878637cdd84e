package com.memberassist.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record InvocationRequest(
        @NotBlank @Size(max = 128) String sessionId,
        @NotBlank @Size(max = 4000) @JsonAlias("userPrompt") String query,
        Map<String, String> context
) {
    public static final int MAX_SESSION_ID_LENGTH = 128;
    public static final int MAX_QUERY_LENGTH = 4000;

    public InvocationRequest {
        Map<String, String> copy = new LinkedHashMap<>();
        if (context != null) {
            context.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        context = Collections.unmodifiableMap(copy);
    }
}
