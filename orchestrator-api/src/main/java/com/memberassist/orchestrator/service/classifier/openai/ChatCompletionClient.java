package com.memberassist.orchestrator.service.classifier.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking client for an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 */
@Component
public class ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final WebClient webClient;

    public ChatCompletionClient(@Qualifier("llmWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    public ChatCompletionResponse complete(Request request, Duration timeout) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.FALSE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }
        if (request.extraParams() != null && !request.extraParams().isEmpty()) {
            payload.putAll(request.extraParams());
        }

        try {
            return webClient.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.class, this::logAndWrap)
                    .block();
        } catch (LlmClientException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Chat completion failed: {}", ex.getMessage());
            throw new LlmClientException("Failed to invoke chat completion", ex);
        }
    }

    private Mono<ChatCompletionResponse> logAndWrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("Chat completion returned {}: {}", status, exception.getResponseBodyAsString());
        return Mono.error(new LlmClientException("Chat completion returned " + status.value(), exception));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens,
                          Map<String, Object> extraParams) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }
}
