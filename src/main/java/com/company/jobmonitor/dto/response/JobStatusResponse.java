package com.company.jobmonitor.dto.response;

import lombok.*;
import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String jobName;
    private String schedule;
    private long alertThresholdMinutes;
    private boolean enabled;

    private String healthState; // HEALTHY, MISSED, FAILED, UNOBSERVED
    private Instant firstObservedAt;
    private Instant lastCheckedAt;
    private Instant lastExpectedAt;
    private Instant nextExpectedAt;

    private Instant lastBuildTime;
    private Long lastBuildNumber;
    private String lastBuildStatus;
    private int consecutiveMissCount;

    private String lastAlertKind;
    private Instant lastAlertSentAt;

    // Jenkins reachability for this job
    private int consecutiveSourceFailures;
    private boolean sourceUnreachable;
}
