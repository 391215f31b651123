package com.whereq.transcribe.exception;

/**
 * Exception thrown when a notification cannot be delivered. Logged only, never affects job state
 */
public class NotificationDeliveryException extends TranscriptionException {
    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
