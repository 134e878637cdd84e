package com.memberassist.orchestrator.service.fallback;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Availability backstop of the workflow. Maps a reason to its fixed message without any external call.
 */
@Component
public class FallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(FallbackHandler.class);

    private final MeterRegistry meterRegistry;

    public FallbackHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public String messageFor(FallbackReason reason) {
        return messageFor(reason, null);
    }

    /**
     * @param directResponse classifier supplied reply, only honoured for {@link FallbackReason#CONVERSATIONAL}
     */
    public String messageFor(FallbackReason reason, String directResponse) {
        FallbackReason effective = reason == null ? FallbackReason.SERVICE_UNAVAILABLE : reason;
        try {
            meterRegistry.counter("orchestrator.fallbacks", "reason", effective.code()).increment();
        } catch (RuntimeException ex) {
            log.debug("Unable to record fallback metric for {}", effective.code(), ex);
        }
        log.info("Fallback issued with reason {}", effective.code());
        if (effective == FallbackReason.CONVERSATIONAL && directResponse != null && !directResponse.isBlank()) {
            return directResponse.trim();
        }
        return effective.message();
    }
}
