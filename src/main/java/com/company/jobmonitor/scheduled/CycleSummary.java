package com.company.jobmonitor.scheduled;

import com.company.jobmonitor.domain.JobCheckResult;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one monitoring cycle across all enabled jobs.
 */
@Value
@Builder
public class CycleSummary {
    Instant startedAt;
    Duration duration;
    @Singular
    List<JobCheckResult> results;
    /** Jobs left out because their previous check was still running. */
    @Singular("skippedJob")
    List<String> skippedJobs;

    public long count(CheckOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    public long incidentCount() {
        return results.stream().filter(JobCheckResult::hasIncident).count();
    }
}
