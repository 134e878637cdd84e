package com.memberassist.orchestrator.config;

import java.time.Duration;

/**
 * Immutable tuning values for one workflow engine instance.
 */
public record WorkflowSettings(double highThreshold,
                               double lowThreshold,
                               int maxRetries,
                               Duration baseDelay,
                               Duration maxDelay,
                               int maxClarificationRounds,
                               Duration sessionTtl,
                               int maxHistory,
                               Duration requestTimeout,
                               Duration toolTimeout) {

    public static final double MAX_CONFIDENCE = 10.0;

    public WorkflowSettings {
        if (lowThreshold < 0.0 || highThreshold > MAX_CONFIDENCE || lowThreshold > highThreshold) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= low (%s) <= high (%s) <= 10".formatted(lowThreshold, highThreshold));
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (maxClarificationRounds < 0) {
            throw new IllegalArgumentException("maxClarificationRounds must not be negative");
        }
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be at least 1");
        }
        requirePositive(sessionTtl, "sessionTtl");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(toolTimeout, "toolTimeout");
        if (baseDelay == null || baseDelay.isNegative() || maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Backoff delays must satisfy 0 <= baseDelay <= maxDelay");
        }
    }

    public static WorkflowSettings defaults() {
        return new WorkflowSettings(7.0, 5.0, 3, Duration.ofMillis(200), Duration.ofSeconds(2), 2,
                Duration.ofMinutes(30), 20, Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    /**
     * Delay before retry number {@code retry} (1-based): {@code baseDelay * 2^retry}, capped at {@code maxDelay}.
     */
    public Duration backoffFor(int retry) {
        if (retry <= 0 || baseDelay.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.min(retry, 30);
        long millis = baseDelay.toMillis();
        long scaled = millis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : millis << shift;
        return scaled >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(scaled);
    }

    public WorkflowSettings withThresholds(double high, double low) {
        return new WorkflowSettings(high, low, maxRetries, baseDelay, maxDelay, maxClarificationRounds,
                sessionTtl, maxHistory, requestTimeout, toolTimeout);
    }

    public WorkflowSettings withRetry(int retries, Duration base, Duration max) {
        return new WorkflowSettings(highThreshold, lowThreshold, retries, base, max, maxClarificationRounds,
                sessionTtl, maxHistory, requestTimeout, toolTimeout);
    }

    public WorkflowSettings withMaxClarificationRounds(int rounds) {
        return new WorkflowSettings(highThreshold, lowThreshold, maxRetries, baseDelay, maxDelay, rounds,
                sessionTtl, maxHistory, requestTimeout, toolTimeout);
    }

    public WorkflowSettings withSession(Duration ttl, int history) {
        return new WorkflowSettings(highThreshold, lowThreshold, maxRetries, baseDelay, maxDelay, maxClarificationRounds,
                ttl, history, requestTimeout, toolTimeout);
    }

    public WorkflowSettings withTimeouts(Duration request, Duration tool) {
        return new WorkflowSettings(highThreshold, lowThreshold, maxRetries, baseDelay, maxDelay, maxClarificationRounds,
                sessionTtl, maxHistory, request, tool);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
