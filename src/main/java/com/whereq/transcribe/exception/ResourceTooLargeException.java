package com.whereq.transcribe.exception;

/**
 * Exception thrown when a resource exceeds the queued transcription size limit
 */
public class ResourceTooLargeException extends InvalidResourceException {
    public ResourceTooLargeException(String message) {
        super(message);
    }

    public ResourceTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
