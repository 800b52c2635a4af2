package com.company.jobmonitor.domain.enums;

public enum CheckOutcome {
    /** First observation of the job; tracking record seeded, schedule not judged. */
    SEEDED,
    /** A build happened at or after the most recent due instant. */
    COMPLIANT,
    /** Behind schedule but still inside the alert threshold, or not yet judgeable. */
    PENDING,
    MISSED,
    FAILED,
    RECOVERED,
    /** Execution source could not be reached; nothing recorded. */
    SOURCE_UNAVAILABLE,
    /** Schedule has no matching instant; the job cannot be judged. */
    SCHEDULE_ERROR,
    /** Unexpected failure while checking; nothing recorded. */
    ERROR
}
