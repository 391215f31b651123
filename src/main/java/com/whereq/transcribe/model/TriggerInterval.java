package com.whereq.transcribe.model;

import java.time.Duration;

/**
 * Supported drain trigger intervals
 */
public enum TriggerInterval {
    FIVE_MINUTES(5),
    FIFTEEN_MINUTES(15),
    THIRTY_MINUTES(30),
    SIXTY_MINUTES(60);

    private final int minutes;

    TriggerInterval(int minutes) {
        this.minutes = minutes;
    }

    public int getMinutes() {
        return minutes;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }
}
