package com.memberassist.orchestrator.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionEvictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionEvictionScheduler.class);

    private final SessionStore sessionStore;

    public SessionEvictionScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${orchestrator.session.eviction-interval:PT60S}",
            initialDelayString = "${orchestrator.session.eviction-interval:PT60S}")
    public void sweep() {
        try {
            int evicted = sessionStore.evictExpired();
            log.debug("Session sweep removed {} sessions", evicted);
        } catch (RuntimeException e) {
            log.warn("Session sweep failed: {}", e.getMessage(), e);
        }
    }
}
