package com.whereq.transcribe.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → PROCESSING → {COMPLETE, FAILED}
 * PENDING → PENDING (transient submission failure, retried on a later tick)
 * PENDING → FAILED (precondition failure or attempts exhausted)
 */
public enum JobStatus {
    /**
     * Queued, waiting to be submitted to the transcription service
     */
    PENDING,

    /**
     * Accepted by the transcription service, waiting for its result
     */
    PROCESSING,

    /**
     * Transcript document created
     */
    COMPLETE,

    /**
     * Terminated with error
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
