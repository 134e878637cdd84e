package com.memberassist.orchestrator.service.tools;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

@Component
public class ToolAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(ToolAuditLogger.class);

    private final MeterRegistry meterRegistry;

    public ToolAuditLogger(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void attempt(String toolName, String sessionId, int attempt, boolean success, String detail) {
        meterRegistry.counter("orchestrator.tools.attempts", "tool", toolName, "outcome", success ? "success" : "failure")
                .increment();
        if (success) {
            log.info("TOOL_AUDIT session={} tool={} attempt={} success=true timestamp={}",
                    sessionId, toolName, attempt, OffsetDateTime.now());
            return;
        }
        log.warn("TOOL_AUDIT session={} tool={} attempt={} success=false detail={} timestamp={}",
                sessionId, toolName, attempt, detail, OffsetDateTime.now());
    }

    public void exhausted(String toolName, String sessionId, int attempts) {
        log.warn("TOOL_EXHAUSTED session={} tool={} attempts={}", sessionId, toolName, attempts);
    }
}
