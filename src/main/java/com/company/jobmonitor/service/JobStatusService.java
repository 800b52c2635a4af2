package com.company.jobmonitor.service;

import com.company.jobmonitor.config.JobCatalog;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.dto.response.JobStatusResponse;
import com.company.jobmonitor.exception.JobNotFoundException;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;
import com.company.jobmonitor.scheduled.SourceHealthTracker;
import com.company.jobmonitor.store.JobTrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view over configured jobs and their tracking state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobStatusService {

    private final JobCatalog catalog;
    private final JobTrackingStore trackingStore;
    private final SourceHealthTracker sourceHealth;
    private final Clock clock;

    public List<JobStatusResponse> getAllStatuses() {
        return catalog.allJobs().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public JobStatusResponse getStatus(String jobName) {
        JobSpec job = catalog.find(jobName)
                .orElseThrow(() -> new JobNotFoundException(jobName));
        return toResponse(job);
    }

    private JobStatusResponse toResponse(JobSpec job) {
        JobStatusResponse.JobStatusResponseBuilder response = JobStatusResponse.builder()
                .jobName(job.getId())
                .schedule(job.getCronExpression())
                .alertThresholdMinutes(job.getAlertThreshold().toMinutes())
                .enabled(job.isEnabled())
                .nextExpectedAt(nextDue(job))
                .consecutiveSourceFailures(sourceHealth.consecutiveFailures(job.getId()))
                .sourceUnreachable(sourceHealth.isUnreachable(job.getId()));

        trackingStore.snapshot(job.getId()).ifPresentOrElse(
                record -> applyRecord(response, record),
                () -> response.healthState("UNOBSERVED"));

        return response.build();
    }

    private void applyRecord(JobStatusResponse.JobStatusResponseBuilder response, JobTrackingRecord record) {
        response.healthState(record.isSeeded() ? record.getHealthState().name() : "UNOBSERVED")
                .firstObservedAt(record.getFirstObservedAt())
                .lastCheckedAt(record.getLastCheckedAt())
                .lastExpectedAt(record.getLastDueInstant())
                .lastBuildTime(record.getLastBuildTimeSeen())
                .lastBuildNumber(record.getLastBuildNumberSeen())
                .lastBuildStatus(record.getLastBuildStatusSeen() == null ? null : record.getLastBuildStatusSeen().name())
                .consecutiveMissCount(record.getConsecutiveMissCount())
                .lastAlertKind(record.getLastAlertKindSent() == null ? null : record.getLastAlertKindSent().name())
                .lastAlertSentAt(record.getLastAlertSentAt());
    }

    private Instant nextDue(JobSpec job) {
        try {
            return job.getSchedule().nextAfter(clock.instant());
        } catch (ScheduleUnsatisfiableException e) {
            log.warn("No upcoming run for job '{}': {}", job.getId(), e.getMessage());
            return null;
        }
    }
}
