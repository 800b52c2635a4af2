package com.company.jobmonitor.exception;

public class InvalidCronExpressionException extends MonitorConfigException {
    public InvalidCronExpressionException(String message) {
        super(message);
    }

    public InvalidCronExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
