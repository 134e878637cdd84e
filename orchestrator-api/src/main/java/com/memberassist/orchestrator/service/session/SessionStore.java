package com.memberassist.orchestrator.service.session;

import java.util.Optional;

public interface SessionStore {

    /**
     * Returns the live session for {@code sessionId}, or a fresh one when it is unknown or expired.
     * Every call extends the session's time-to-live.
     */
    Session getOrCreate(String sessionId);

    /**
     * Atomically replaces the stored session.
     *
     * @throws ConcurrentSessionModificationException if the session was evicted, expired or rewritten
     *                                                since {@code updated} was read
     */
    void save(String sessionId, Session updated);

    /**
     * Removes sessions idle for longer than the configured TTL as of the start of the sweep.
     *
     * @return number of sessions removed
     */
    int evictExpired();

    boolean evict(String sessionId);

    /**
     * Reads without refreshing the TTL.
     */
    Optional<Session> find(String sessionId);
}
