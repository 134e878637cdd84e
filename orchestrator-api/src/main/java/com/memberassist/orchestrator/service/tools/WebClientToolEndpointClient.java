package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

@Component
public class WebClientToolEndpointClient implements ToolEndpointClient {

    private final WebClient toolWebClient;

    public WebClientToolEndpointClient(@Qualifier("toolWebClient") WebClient toolWebClient) {
        this.toolWebClient = toolWebClient;
    }

    @Override
    public Map<String, Object> invoke(ToolDefinition tool, ToolCall call, Duration timeout) {
        ToolEndpointResponse response;
        try {
            response = toolWebClient.post()
                    .uri(tool.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(call)
                    .retrieve()
                    .bodyToMono(ToolEndpointResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new ToolInvocationException(tool.name(),
                    "Tool %s returned %d".formatted(tool.name(), e.getStatusCode().value()), e);
        } catch (RuntimeException e) {
            throw new ToolInvocationException(tool.name(),
                    "Tool %s call failed: %s".formatted(tool.name(), e.getMessage()), e);
        }
        if (response == null) {
            throw new ToolInvocationException(tool.name(), "Tool %s returned an empty body".formatted(tool.name()));
        }
        if (!response.ok()) {
            String detail = response.error() == null ? "ok=false" : response.error();
            throw new ToolInvocationException(tool.name(), "Tool %s reported failure: %s".formatted(tool.name(), detail));
        }
        return response.payload() == null ? Map.of() : response.payload();
    }

    record ToolEndpointResponse(boolean ok, Map<String, Object> payload, String error) {
    }
}
