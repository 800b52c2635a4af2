package com.company.jobmonitor.domain.enums;

/**
 * How a job first seen by the monitor is judged against instants that were due
 * before monitoring began.
 */
public enum FirstObservationPolicy {
    /**
     * Only due instants at or after the first observation are judged; a job that
     * has never built is judged from the second check on.
     */
    FULL_PERIOD,
    /** Every check after the first judges against the most recent due instant. */
    IMMEDIATE
}
