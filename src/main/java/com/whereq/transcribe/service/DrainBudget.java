package com.whereq.transcribe.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one drain tick
 */
public class DrainBudget {

    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;

    private DrainBudget(Clock clock, Duration budget) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(budget);
    }

    public static DrainBudget start(Clock clock, Duration budget) {
        return new DrainBudget(clock, budget);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public boolean exhausted() {
        return !clock.instant().isBefore(deadline);
    }
}
