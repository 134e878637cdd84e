package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import com.memberassist.orchestrator.service.catalog.ToolParameters;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientToolEndpointClientTest {

    private static final ToolDefinition CLAIMS = new ToolDefinition("ClaimsAgent", "Claim status.",
            URI.create("https://tools.test/claims"), List.of("claims"),
            new ToolParameters(List.of("member_id"), List.of()), List.of());

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void postsToCatalogEndpointAndReturnsPayload() {
        WebClientToolEndpointClient client = respond(HttpStatus.OK, "{\"ok\":true,\"payload\":{\"status\":\"paid\",\"claimId\":\"CLM-1\"}}");

        Map<String, Object> payload = client.invoke(CLAIMS,
                new ToolCall("Was my claim paid?", Map.of("memberId", "M-1"), Map.of(), Map.of("member_id", "M-1")),
                Duration.ofSeconds(2));

        assertThat(payload).containsEntry("status", "paid").containsEntry("claimId", "CLM-1");
        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.url()).isEqualTo(URI.create("https://tools.test/claims"));
            assertThat(request.method().name()).isEqualTo("POST");
        });
    }

    @Test
    void reportedFailureBecomesInvocationException() {
        WebClientToolEndpointClient client = respond(HttpStatus.OK, "{\"ok\":false,\"error\":\"member not found\"}");

        assertThatThrownBy(() -> client.invoke(CLAIMS, new ToolCall("q", null, null, null), Duration.ofSeconds(2)))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("member not found")
                .satisfies(ex -> assertThat(((ToolInvocationException) ex).toolName()).isEqualTo("ClaimsAgent"));
    }

    @Test
    void errorStatusBecomesInvocationException() {
        WebClientToolEndpointClient client = respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> client.invoke(CLAIMS, new ToolCall("q", null, null, null), Duration.ofSeconds(2)))
                .isInstanceOf(ToolInvocationException.class)
                .hasMessageContaining("503");
    }

    @Test
    void slowEndpointTimesOut() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.<ClientResponse>never())
                .build();

        assertThatThrownBy(() -> new WebClientToolEndpointClient(webClient)
                .invoke(CLAIMS, new ToolCall("q", null, null, null), Duration.ofMillis(50)))
                .isInstanceOf(ToolInvocationException.class);
    }

    private WebClientToolEndpointClient respond(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientToolEndpointClient(webClient);
    }
}
