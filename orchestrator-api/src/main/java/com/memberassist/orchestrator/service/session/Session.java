package com.memberassist.orchestrator.service.session;

import com.memberassist.orchestrator.model.ConversationTurn;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted conversational context for one session id. Instances are immutable snapshots; every change
 * produces a copy that has to go back through {@link SessionStore#save(String, Session)}.
 */
public record Session(String sessionId,
                      List<ConversationTurn> history,
                      boolean awaitingClarification,
                      int clarificationRounds,
                      String pendingQuery,
                      String pendingQuestion,
                      Instant createdAt,
                      Instant lastAccessedAt,
                      long version) {

    public Session {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static Session open(String sessionId, Instant now, long version) {
        return new Session(sessionId, List.of(), false, 0, null, null, now, now, version);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return lastAccessedAt.plus(ttl).isBefore(now);
    }

    public boolean sameLineage(Session other) {
        return other != null
                && sessionId.equals(other.sessionId)
                && createdAt.equals(other.createdAt)
                && version == other.version;
    }

    public Session touch(Instant now) {
        return new Session(sessionId, history, awaitingClarification, clarificationRounds, pendingQuery,
                pendingQuestion, createdAt, now, version);
    }

    public Session withVersion(long newVersion) {
        return new Session(sessionId, history, awaitingClarification, clarificationRounds, pendingQuery,
                pendingQuestion, createdAt, lastAccessedAt, newVersion);
    }

    /**
     * Appends a turn, dropping the oldest entries once {@code maxHistory} is exceeded.
     */
    public Session append(ConversationTurn turn, int maxHistory) {
        List<ConversationTurn> updated = new ArrayList<>(history);
        updated.add(turn);
        while (updated.size() > maxHistory) {
            updated.remove(0);
        }
        return new Session(sessionId, updated, awaitingClarification, clarificationRounds, pendingQuery,
                pendingQuestion, createdAt, lastAccessedAt, version);
    }

    public Session awaitClarification(String originalQuery, String question) {
        return new Session(sessionId, history, true, clarificationRounds + 1, originalQuery, question,
                createdAt, lastAccessedAt, version);
    }

    public Session resetClarification() {
        return new Session(sessionId, history, false, 0, null, null, createdAt, lastAccessedAt, version);
    }
}
