package com.example.feedreader.shared.exception;

/**
 * A notification payload could not be parsed or serialized.
 */
public class NotificationFormatException extends RuntimeException {

    public NotificationFormatException(String message) {
        super(message);
    }

    public NotificationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
