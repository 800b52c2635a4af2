package com.company.jobmonitor.exception;

/**
 * Invalid monitor configuration. Raised while loading, aborts startup.
 */
public class MonitorConfigException extends RuntimeException {
    public MonitorConfigException(String message) {
        super(message);
    }

    public MonitorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
