package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.service.catalog.ToolDefinition;

import java.time.Duration;
import java.util.Map;

public interface ToolEndpointClient {

    /**
     * Performs a single attempt against the tool's endpoint.
     *
     * @return the payload of an {@code ok} answer, never {@code null}
     * @throws ToolInvocationException on transport errors, timeouts and {@code ok=false} answers
     */
    Map<String, Object> invoke(ToolDefinition tool, ToolCall call, Duration timeout);
}
