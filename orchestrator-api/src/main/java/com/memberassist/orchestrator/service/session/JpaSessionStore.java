package com.memberassist.orchestrator.service.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.persistence.entity.SessionEntity;
import com.memberassist.orchestrator.persistence.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Service
@Profile("jpa")
@Transactional
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final SessionRepository sessionRepository;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public JpaSessionStore(SessionRepository sessionRepository,
                           ObjectMapper objectMapper,
                           WorkflowSettings settings,
                           Clock clock) {
        this.sessionRepository = sessionRepository;
        this.objectMapper = objectMapper;
        this.ttl = settings.sessionTtl();
        this.clock = clock;
    }

    @Override
    public Session getOrCreate(String sessionId) {
        Instant now = now();
        SessionEntity entity = sessionRepository.findById(sessionId).orElse(null);
        if (entity != null && entity.getLastAccessedAt().plus(ttl).isBefore(now)) {
            log.debug("Session {} expired (last access {}), starting over", sessionId, entity.getLastAccessedAt());
            sessionRepository.delete(entity);
            sessionRepository.flush();
            entity = null;
        }
        if (entity == null) {
            entity = new SessionEntity(sessionId, now);
        } else {
            entity.setLastAccessedAt(now);
        }
        return toSession(sessionRepository.saveAndFlush(entity));
    }

    @Override
    public void save(String sessionId, Session updated) {
        Instant now = now();
        SessionEntity entity = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ConcurrentSessionModificationException(sessionId,
                        "Session %s was evicted before it could be saved".formatted(sessionId)));
        if (entity.getLastAccessedAt().plus(ttl).isBefore(now)) {
            throw new ConcurrentSessionModificationException(sessionId, "Session %s expired before it could be saved".formatted(sessionId));
        }
        if (!entity.getCreatedAt().equals(updated.createdAt()) || entity.getVersion() != updated.version()) {
            throw new ConcurrentSessionModificationException(sessionId, "Session %s was modified concurrently".formatted(sessionId));
        }
        entity.setHistoryJson(writeHistory(updated.history()));
        entity.setAwaitingClarification(updated.awaitingClarification());
        entity.setClarificationRounds(updated.clarificationRounds());
        entity.setPendingQuery(updated.pendingQuery());
        entity.setPendingQuestion(updated.pendingQuestion());
        entity.setLastAccessedAt(now);
        try {
            sessionRepository.saveAndFlush(entity);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConcurrentSessionModificationException(sessionId, "Session %s was modified concurrently".formatted(sessionId), e);
        }
    }

    @Override
    public int evictExpired() {
        int evicted = sessionRepository.deleteIdleSince(now().minus(ttl));
        if (evicted > 0) {
            log.info("Evicted {} expired sessions", evicted);
        }
        return evicted;
    }

    @Override
    public boolean evict(String sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return false;
        }
        sessionRepository.deleteById(sessionId);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> find(String sessionId) {
        return sessionRepository.findById(sessionId).map(this::toSession);
    }

    private Session toSession(SessionEntity entity) {
        return new Session(
                entity.getSessionId(),
                readHistory(entity.getHistoryJson()),
                entity.isAwaitingClarification(),
                entity.getClarificationRounds(),
                entity.getPendingQuery(),
                entity.getPendingQuestion(),
                entity.getCreatedAt(),
                entity.getLastAccessedAt(),
                entity.getVersion()
        );
    }

    private Instant now() {
        // column precision is microseconds; keep in-memory and stored values identical
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private String writeHistory(List<ConversationTurn> history) {
        try {
            return objectMapper.writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session history", e);
        }
    }

    private List<ConversationTurn> readHistory(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<ConversationTurn>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize session history, starting with an empty one", e);
            return List.of();
        }
    }
}
