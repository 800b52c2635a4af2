package com.company.jobmonitor.domain;

import com.company.jobmonitor.domain.enums.BuildStatus;
import com.company.jobmonitor.domain.enums.IncidentKind;
import com.company.jobmonitor.domain.enums.JobHealthState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * In-memory tracking state of one job, mutated only by the conformance engine
 * while it holds the job's lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobTrackingRecord {
    private String jobId;

    // Observation
    private Instant firstObservedAt;
    private Instant lastCheckedAt;
    private Instant lastDueInstant;

    // Latest build seen
    private Instant lastBuildTimeSeen;
    private BuildStatus lastBuildStatusSeen;
    private Long lastBuildNumberSeen;

    // Schedule conformance
    private int consecutiveMissCount;
    @Builder.Default
    private JobHealthState healthState = JobHealthState.HEALTHY;

    // Alert suppression
    private IncidentKind lastAlertKindSent;
    private Instant lastAlertSentAt;

    public static JobTrackingRecord initial(String jobId) {
        return JobTrackingRecord.builder().jobId(jobId).build();
    }

    public boolean isSeeded() {
        return firstObservedAt != null;
    }

    public JobTrackingRecord copy() {
        return toBuilder().build();
    }

    public void clearSuppression() {
        this.lastAlertKindSent = null;
        this.lastAlertSentAt = null;
    }
}
