package com.whereq.transcribe.exception;

/**
 * Exception thrown when a resource cannot be found or read
 */
public class ResourceNotFoundException extends InvalidResourceException {
    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
