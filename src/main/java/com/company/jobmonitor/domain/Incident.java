package com.company.jobmonitor.domain;

import com.company.jobmonitor.domain.enums.BuildStatus;
import com.company.jobmonitor.domain.enums.IncidentKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Alert-worthy condition of one job detected by one check. Not persisted.
 */
@Value
@Builder
public class Incident {
    String jobId;
    IncidentKind kind;
    Instant detectedAt;

    // Context
    String schedule;
    Duration alertThreshold;
    /** Scheduled instant the job was measured against. */
    Instant expectedAt;
    Instant lastBuildTime;
    Long lastBuildNumber;
    BuildStatus lastBuildStatus;
    String lastBuildUrl;
    String summary;

    /** Time elapsed since the scheduled instant, for missed incidents. */
    public Duration getOverdueBy() {
        if (expectedAt == null || detectedAt == null) {
            return null;
        }
        return Duration.between(expectedAt, detectedAt);
    }
}
