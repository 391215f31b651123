package com.whereq.transcribe.exception;

/**
 * Exception thrown when the transcription service reports a failed job
 */
public class ExternalProcessingException extends TranscriptionException {
    public ExternalProcessingException(String message) {
        super(message);
    }

    public ExternalProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
