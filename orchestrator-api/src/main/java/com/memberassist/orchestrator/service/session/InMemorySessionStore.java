package com.memberassist.orchestrator.service.session;

import com.memberassist.orchestrator.config.WorkflowSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Profile("!jpa")
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicLong revisions = new AtomicLong();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStore(WorkflowSettings settings, Clock clock) {
        this.ttl = settings.sessionTtl();
        this.clock = clock;
    }

    @Override
    public Session getOrCreate(String sessionId) {
        Instant now = clock.instant();
        return sessions.compute(sessionId, (id, existing) -> {
            if (existing == null) {
                log.debug("Opening session {}", id);
                return Session.open(id, now, revisions.incrementAndGet());
            }
            if (existing.isExpired(now, ttl)) {
                log.debug("Session {} expired (last access {}), starting over", id, existing.lastAccessedAt());
                return Session.open(id, now, revisions.incrementAndGet());
            }
            return existing.touch(now).withVersion(revisions.incrementAndGet());
        });
    }

    @Override
    public void save(String sessionId, Session updated) {
        Instant now = clock.instant();
        sessions.compute(sessionId, (id, current) -> {
            if (current == null || current.isExpired(now, ttl)) {
                throw new ConcurrentSessionModificationException(id, "Session %s was evicted before it could be saved".formatted(id));
            }
            if (!current.sameLineage(updated)) {
                throw new ConcurrentSessionModificationException(id, "Session %s was modified concurrently".formatted(id));
            }
            return updated.touch(now).withVersion(revisions.incrementAndGet());
        });
    }

    @Override
    public int evictExpired() {
        Instant sweepStart = clock.instant();
        AtomicInteger evicted = new AtomicInteger();
        for (String sessionId : sessions.keySet()) {
            sessions.computeIfPresent(sessionId, (id, session) -> {
                if (session.isExpired(sweepStart, ttl)) {
                    evicted.incrementAndGet();
                    return null;
                }
                return session;
            });
        }
        if (evicted.get() > 0) {
            log.info("Evicted {} expired sessions", evicted.get());
        }
        return evicted.get();
    }

    @Override
    public boolean evict(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }
}
