package com.whereq.transcribe.model;

/**
 * Result of a completion attempt
 */
public enum CompletionOutcome {
    COMPLETED,
    FAILED,

    /**
     * Job was already complete or failed when re-read under the lock
     */
    ALREADY_TERMINAL,

    /**
     * Lock not acquired within its timeout, retried on a later tick
     */
    LOCK_TIMEOUT
}
