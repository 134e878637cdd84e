package com.memberassist.orchestrator.service.session;

import com.memberassist.orchestrator.MutableClock;
import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.model.TurnRole;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final WorkflowSettings settings = WorkflowSettings.defaults().withSession(Duration.ofMinutes(30), 3);
    private final InMemorySessionStore store = new InMemorySessionStore(settings, clock);

    @Test
    void createsSessionOnFirstAccessAndRefreshesTtl() {
        Session created = store.getOrCreate("s-1");
        assertThat(created.history()).isEmpty();
        assertThat(created.awaitingClarification()).isFalse();

        clock.advance(Duration.ofMinutes(20));
        Session again = store.getOrCreate("s-1");
        assertThat(again.createdAt()).isEqualTo(created.createdAt());
        assertThat(again.lastAccessedAt()).isEqualTo(clock.instant());

        clock.advance(Duration.ofMinutes(20));
        assertThat(store.getOrCreate("s-1").createdAt()).isEqualTo(created.createdAt());
    }

    @Test
    void expiredSessionStartsOver() {
        Session session = store.getOrCreate("s-2");
        store.save("s-2", session
                .append(turn("What are my dental benefits?"), settings.maxHistory())
                .awaitClarification("What are my dental benefits?", "Benefits or claims?"));

        clock.advance(Duration.ofMinutes(31));
        Session fresh = store.getOrCreate("s-2");

        assertThat(fresh.history()).isEmpty();
        assertThat(fresh.awaitingClarification()).isFalse();
        assertThat(fresh.clarificationRounds()).isZero();
        assertThat(fresh.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void saveFailsWhenSessionWasEvictedInBetween() {
        Session session = store.getOrCreate("s-3");
        store.evict("s-3");

        assertThatThrownBy(() -> store.save("s-3", session))
                .isInstanceOf(ConcurrentSessionModificationException.class)
                .hasMessageContaining("evicted");
    }

    @Test
    void saveFailsWhenSessionWasRewritten() {
        Session first = store.getOrCreate("s-4");
        Session second = store.getOrCreate("s-4");
        store.save("s-4", second.append(turn("newer"), settings.maxHistory()));

        assertThatThrownBy(() -> store.save("s-4", first.append(turn("stale"), settings.maxHistory())))
                .isInstanceOf(ConcurrentSessionModificationException.class);
        assertThat(store.find("s-4").orElseThrow().history())
                .extracting(ConversationTurn::content)
                .containsExactly("newer");
    }

    @Test
    void saveFailsAgainstRecreatedSession() {
        Session old = store.getOrCreate("s-5");
        clock.advance(Duration.ofMinutes(31));
        store.getOrCreate("s-5");

        assertThatThrownBy(() -> store.save("s-5", old))
                .isInstanceOf(ConcurrentSessionModificationException.class);
    }

    @Test
    void historyDropsOldestEntriesFirst() {
        Session session = store.getOrCreate("s-6");
        for (int i = 1; i <= 5; i++) {
            session = session.append(turn("message " + i), settings.maxHistory());
        }
        store.save("s-6", session);

        assertThat(store.find("s-6").orElseThrow().history())
                .extracting(ConversationTurn::content)
                .containsExactly("message 3", "message 4", "message 5");
    }

    @Test
    void sweepRemovesOnlyIdleSessions() {
        store.getOrCreate("idle");
        clock.advance(Duration.ofMinutes(20));
        store.getOrCreate("active");
        clock.advance(Duration.ofMinutes(15));

        assertThat(store.evictExpired()).isEqualTo(1);
        assertThat(store.find("idle")).isEmpty();
        assertThat(store.find("active")).isPresent();
    }

    @Test
    void sweepKeepsSessionAccessedAfterItStarted() {
        AtomicReference<Runnable> duringSweep = new AtomicReference<>();
        MutableClock sweepClock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z")) {
            @Override
            public Instant instant() {
                Instant now = super.instant();
                Runnable hook = duringSweep.getAndSet(null);
                if (hook != null) {
                    hook.run();
                }
                return now;
            }
        };
        InMemorySessionStore sweeping = new InMemorySessionStore(settings, sweepClock);
        sweeping.getOrCreate("busy");
        sweeping.getOrCreate("idle");
        sweepClock.advance(Duration.ofMinutes(31));
        Instant sweepStart = sweepClock.instant();
        duringSweep.set(() -> {
            sweepClock.advance(Duration.ofSeconds(1));
            sweeping.getOrCreate("busy");
        });

        assertThat(sweeping.evictExpired()).isEqualTo(1);
        assertThat(sweeping.find("idle")).isEmpty();
        assertThat(sweeping.find("busy")).get()
                .satisfies(session -> assertThat(session.lastAccessedAt()).isAfter(sweepStart));
    }

    private ConversationTurn turn(String content) {
        return new ConversationTurn(TurnRole.USER, content, clock.instant());
    }
}
