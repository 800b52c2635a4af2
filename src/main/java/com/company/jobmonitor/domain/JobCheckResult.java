package com.company.jobmonitor.domain;

import com.company.jobmonitor.alert.DispatchResult;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * What one check of one job concluded.
 */
@Value
@Builder
public class JobCheckResult {
    String jobId;
    CheckOutcome outcome;
    Incident incident;
    DispatchResult dispatchResult;
    String detail;

    public boolean hasIncident() {
        return incident != null;
    }

    public static JobCheckResult of(String jobId, CheckOutcome outcome, String detail) {
        return JobCheckResult.builder().jobId(jobId).outcome(outcome).detail(detail).build();
    }
}
