package com.whereq.transcribe.exception;

/**
 * Exception thrown when a submission fails in a retryable way (network, 5xx, 429, timeout)
 */
public class TransientSubmissionException extends TranscriptionException {
    public TransientSubmissionException(String message) {
        super(message);
    }

    public TransientSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
