package com.whereq.transcribe.exception;

import java.time.Duration;

/**
 * Exception thrown when a named lock is not acquired within its timeout
 */
public class LockAcquisitionTimeoutException extends TranscriptionException {
    public LockAcquisitionTimeoutException(String lockName, Duration timeout) {
        super("Lock " + lockName + " not acquired within " + timeout);
    }
}
