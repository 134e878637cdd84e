package com.memberassist.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private final Routing routing = new Routing();
    private final Retry retry = new Retry();
    private final Clarification clarification = new Clarification();
    private final Session session = new Session();
    private final Request request = new Request();
    private final Tool tool = new Tool();
    private final Catalog catalog = new Catalog();
    private final Llm llm = new Llm();

    public Routing getRouting() {
        return routing;
    }

    public Retry getRetry() {
        return retry;
    }

    public Clarification getClarification() {
        return clarification;
    }

    public Session getSession() {
        return session;
    }

    public Request getRequest() {
        return request;
    }

    public Tool getTool() {
        return tool;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Llm getLlm() {
        return llm;
    }

    public WorkflowSettings toWorkflowSettings() {
        return new WorkflowSettings(
                routing.getHighThreshold(),
                routing.getLowThreshold(),
                retry.getMaxRetries(),
                retry.getBaseDelay(),
                retry.getMaxDelay(),
                clarification.getMaxRounds(),
                session.getTtl(),
                session.getMaxHistory(),
                request.getTimeout(),
                tool.getTimeout()
        );
    }

    public static class Routing {

        /**
         * Minimum confidence at which the selected tools are executed.
         */
        private double highThreshold = 7.0;

        /**
         * Minimum confidence for a clarification question; anything lower falls back.
         */
        private double lowThreshold = 5.0;

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public double getLowThreshold() {
            return lowThreshold;
        }

        public void setLowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
        }
    }

    public static class Retry {

        /**
         * Total attempts per tool call before the plan is abandoned.
         */
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(2);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Clarification {

        private int maxRounds = 2;

        public int getMaxRounds() {
            return maxRounds;
        }

        public void setMaxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
        }
    }

    public static class Session {

        private Duration ttl = Duration.ofMinutes(30);
        private int maxHistory = 20;
        private Duration evictionInterval = Duration.ofSeconds(60);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxHistory() {
            return maxHistory;
        }

        public void setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
        }

        public Duration getEvictionInterval() {
            return evictionInterval;
        }

        public void setEvictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
        }
    }

    public static class Request {

        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Tool {

        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Catalog {

        private String location = "classpath:tools/tools.yaml";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Llm {

        private String baseUrl = "http://localhost:1234";
        private String apiKey;
        private String model = "claims-router";
        private double temperature = 0.0;
        private int maxOutputTokens = 1024;
        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
