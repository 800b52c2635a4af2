package com.company.jobmonitor.domain;

import com.company.jobmonitor.schedule.CronSchedule;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * A configured job to watch. Built once at startup; immutable afterwards.
 */
@Value
@Builder
public class JobSpec {
    /** Jenkins job name; {@code /} separates folders. */
    @NonNull String id;
    /** Expression as configured, before normalization. */
    @NonNull String cronExpression;
    @NonNull CronSchedule schedule;
    @NonNull Duration alertThreshold;
    boolean enabled;
}
