package com.memberassist.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient llmWebClient(OrchestratorProperties properties) {
        OrchestratorProperties.Llm llm = properties.getLlm();
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(llm.getBaseUrl())
                .exchangeStrategies(exchangeStrategies());
        if (llm.getTimeout() != null && !llm.getTimeout().isZero()) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(llm.getTimeout());
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (llm.hasApiKey()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getApiKey());
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    /**
     * Tool endpoints are absolute URIs from the catalog, so this client has no base URL.
     */
    @Bean
    public WebClient toolWebClient(OrchestratorProperties properties) {
        Duration timeout = properties.getTool().getTimeout();
        HttpClient httpClient = HttpClient.create().responseTimeout(timeout);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies())
                .build();
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
