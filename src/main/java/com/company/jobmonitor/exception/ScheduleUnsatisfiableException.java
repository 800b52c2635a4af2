package com.company.jobmonitor.exception;

import java.time.Instant;

public class ScheduleUnsatisfiableException extends RuntimeException {
    public ScheduleUnsatisfiableException(String expression, Instant reference) {
        super("Cron expression '" + expression + "' has no matching instant in the search window around " + reference);
    }
}
