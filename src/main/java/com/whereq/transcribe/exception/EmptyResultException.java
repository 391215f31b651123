package com.whereq.transcribe.exception;

/**
 * Exception thrown when a successful result carries no transcript text
 */
public class EmptyResultException extends TranscriptionException {
    public EmptyResultException(String message) {
        super(message);
    }

    public EmptyResultException(String message, Throwable cause) {
        super(message, cause);
    }
}
