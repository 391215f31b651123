package com.whereq.transcribe.exception;

/**
 * Exception thrown when the transcript document cannot be created
 */
public class ArtifactCreationException extends TranscriptionException {
    public ArtifactCreationException(String message) {
        super(message);
    }

    public ArtifactCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
