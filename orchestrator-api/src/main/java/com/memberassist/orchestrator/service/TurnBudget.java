package com.memberassist.orchestrator.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock deadline shared by every blocking step of one turn.
 */
public final class TurnBudget {

    private final Clock clock;
    private final Instant deadline;

    private TurnBudget(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static TurnBudget start(Clock clock, Duration total) {
        return new TurnBudget(clock, clock.instant().plus(total));
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean exhausted() {
        return remaining().isZero();
    }

    /**
     * The smaller of {@code limit} and the time left.
     */
    public Duration cap(Duration limit) {
        Duration left = remaining();
        return limit.compareTo(left) < 0 ? limit : left;
    }
}
