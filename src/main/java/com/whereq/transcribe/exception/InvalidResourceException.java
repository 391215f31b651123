package com.whereq.transcribe.exception;

/**
 * Exception thrown when a job's resource reference is missing or unusable
 */
public class InvalidResourceException extends TranscriptionException {
    public InvalidResourceException(String message) {
        super(message);
    }

    public InvalidResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
