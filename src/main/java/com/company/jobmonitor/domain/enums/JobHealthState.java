package com.company.jobmonitor.domain.enums;

/**
 * Alerting state a job is in after its latest check; used to detect recovery.
 */
public enum JobHealthState {
    HEALTHY,
    MISSED,
    FAILED;

    public boolean isIncident() {
        return this != HEALTHY;
    }
}
