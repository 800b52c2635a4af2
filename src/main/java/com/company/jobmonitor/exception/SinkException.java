package com.company.jobmonitor.exception;

/**
 * A notification channel could not deliver an alert.
 */
public class SinkException extends RuntimeException {
    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
