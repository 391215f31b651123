package com.whereq.transcribe.model;

import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one drain tick
 */
@Data
public class DrainReport {
    private Instant startedAt;
    private Duration elapsed;
    private int queueSize;
    private int polled;
    private int submitted;
    private int completed;
    private int failed;
    private int errors;

    /**
     * Jobs left for the next tick because the time budget ran out
     */
    private int deferred;

    /**
     * Queue entries removed because their record was missing or terminal
     */
    private int repaired;

    private boolean budgetExhausted;

    public void incrementPolled() {
        polled++;
    }

    public void incrementSubmitted() {
        submitted++;
    }

    public void incrementCompleted() {
        completed++;
    }

    public void incrementFailed() {
        failed++;
    }

    public void incrementErrors() {
        errors++;
    }

    public void incrementDeferred() {
        deferred++;
    }

    public void incrementRepaired() {
        repaired++;
    }
}
