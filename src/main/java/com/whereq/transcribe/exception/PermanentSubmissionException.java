package com.whereq.transcribe.exception;

/**
 * Exception thrown when the transcription service rejects a request in a non-retryable way
 */
public class PermanentSubmissionException extends TranscriptionException {
    public PermanentSubmissionException(String message) {
        super(message);
    }

    public PermanentSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
