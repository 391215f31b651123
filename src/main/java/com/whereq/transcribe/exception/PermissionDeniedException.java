package com.whereq.transcribe.exception;

/**
 * Exception thrown when the caller may not submit transcription jobs
 */
public class PermissionDeniedException extends TranscriptionException {
    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
