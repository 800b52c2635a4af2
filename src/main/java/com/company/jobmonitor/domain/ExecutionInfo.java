package com.company.jobmonitor.domain;

import com.company.jobmonitor.domain.enums.BuildStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest execution of a job as reported by the execution source at one check.
 */
@Value
@Builder
public class ExecutionInfo {
    Instant observedAt;
    /** Null when the job has never run. */
    Instant lastBuildTime;
    @Builder.Default
    BuildStatus lastBuildStatus = BuildStatus.UNKNOWN;
    Long lastBuildNumber;
    String lastBuildUrl;

    public boolean hasBuild() {
        return lastBuildTime != null;
    }

    public static ExecutionInfo neverBuilt(Instant observedAt) {
        return ExecutionInfo.builder().observedAt(observedAt).build();
    }
}
