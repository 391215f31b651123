package com.whereq.transcribe.model;

/**
 * Result of polling one processing job
 */
public enum PollOutcome {
    /**
     * Still running remotely
     */
    RUNNING,
    COMPLETED,
    FAILED,

    /**
     * Service unreachable, unrecognized status, or completion lock not acquired
     */
    UNCHANGED
}
