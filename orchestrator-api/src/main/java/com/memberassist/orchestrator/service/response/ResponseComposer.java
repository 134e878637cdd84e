package com.memberassist.orchestrator.service.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberassist.orchestrator.model.InvocationResponse;
import com.memberassist.orchestrator.model.ToolResult;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import com.memberassist.orchestrator.service.routing.Route;
import com.memberassist.orchestrator.service.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a finished {@link WorkflowState} into the outward response. Reads the state only, so composing the
 * same state twice yields equal responses.
 */
@Component
public class ResponseComposer {

    private static final Logger log = LoggerFactory.getLogger(ResponseComposer.class);
    private static final List<String> TEXT_FIELDS = List.of("response", "answer", "message", "text");

    private final ObjectMapper objectMapper;

    public ResponseComposer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InvocationResponse compose(WorkflowState state) {
        Instant finishedAt = state.completedAt() == null ? state.startedAt() : state.completedAt();
        long elapsed = Math.max(0L, Duration.between(state.startedAt(), finishedAt).toMillis());
        FallbackReason reason = state.fallbackReason();
        boolean success = reason == null || reason == FallbackReason.CONVERSATIONAL;
        return new InvocationResponse(
                state.sessionId(),
                state.selectedTools(),
                state.confidence(),
                responseText(state),
                state.route() == null ? null : state.route().name(),
                reason == null ? null : reason.code(),
                success,
                elapsed,
                OffsetDateTime.ofInstant(finishedAt, ZoneOffset.UTC),
                null
        );
    }

    private String responseText(WorkflowState state) {
        if (state.responseText() != null) {
            return state.responseText();
        }
        if (state.route() == Route.EXECUTE) {
            List<ToolResult> succeeded = state.toolResults().stream()
                    .filter(ToolResult::success)
                    .toList();
            String rendered = succeeded.stream()
                    .map(this::render)
                    .filter(text -> !text.isBlank())
                    .collect(Collectors.joining("\n\n"));
            if (rendered.isBlank()) {
                return succeeded.stream()
                        .map(result -> "Tool '%s' executed successfully for: %s".formatted(result.toolName(), state.query()))
                        .collect(Collectors.joining("\n"));
            }
            return rendered;
        }
        return "";
    }

    private String render(ToolResult result) {
        Map<String, Object> payload = result.payload();
        for (String field : TEXT_FIELDS) {
            Object value = payload.get(field);
            if (value instanceof String text && !text.isBlank()) {
                return text.trim();
            }
        }
        if (payload.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Unable to render payload of {}", result.toolName(), e);
            return payload.toString();
        }
    }
}
