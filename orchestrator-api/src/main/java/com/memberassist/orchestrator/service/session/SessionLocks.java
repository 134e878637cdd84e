package com.memberassist.orchestrator.service.session;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer discipline per session id. Lock entries are reference counted so the map only holds ids
 * that currently have an owner or a waiter.
 */
@Component
public class SessionLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public Optional<Lease> tryAcquire(String sessionId, Duration timeout) throws InterruptedException {
        Entry entry = locks.compute(sessionId, (id, existing) -> {
            Entry target = existing == null ? new Entry() : existing;
            target.references++;
            return target;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } finally {
            if (!acquired) {
                release(sessionId);
            }
        }
        return acquired ? Optional.of(new Lease(sessionId, entry)) : Optional.empty();
    }

    public boolean isHeld(String sessionId) {
        Entry entry = locks.get(sessionId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedSessions() {
        return locks.size();
    }

    private void release(String sessionId) {
        locks.compute(sessionId, (id, existing) -> {
            if (existing == null) {
                return null;
            }
            existing.references--;
            return existing.references <= 0 ? null : existing;
        });
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }

    public final class Lease implements AutoCloseable {

        private final String sessionId;
        private final Entry entry;
        private boolean closed;

        private Lease(String sessionId, Entry entry) {
            this.sessionId = sessionId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            entry.lock.unlock();
            release(sessionId);
        }
    }
}
