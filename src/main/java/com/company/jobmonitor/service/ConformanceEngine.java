package com.company.jobmonitor.service;

import com.company.jobmonitor.alert.AlertDispatcher;
import com.company.jobmonitor.alert.DispatchResult;
import com.company.jobmonitor.domain.ExecutionInfo;
import com.company.jobmonitor.domain.JobCheckResult;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;
import com.company.jobmonitor.exception.SourceUnavailableException;
import com.company.jobmonitor.source.ExecutionSource;
import com.company.jobmonitor.store.JobTrackingStore;
import com.company.jobmonitor.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one check of one job: fetch the latest execution, decide, record, alert.
 * <p>
 * The fetch runs without any lock. Deciding, committing the tracking record and
 * dispatching happen under the job's lock, so two checks of the same job never
 * interleave. A failed fetch leaves the tracking store untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConformanceEngine {

    private static final String MDC_JOB_ID_KEY = "jobId";

    private final ExecutionSource executionSource;
    private final JobTrackingStore trackingStore;
    private final ConformanceDecider decider;
    private final AlertDispatcher alertDispatcher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public JobCheckResult check(JobSpec job) {
        MDC.put(MDC_JOB_ID_KEY, job.getId());
        try {
            log.debug("Checking job: {}", job.getId());

            ExecutionInfo info;
            try {
                info = executionSource.fetchLatestExecution(job);
            } catch (SourceUnavailableException e) {
                log.warn("Execution source unavailable for job '{}' ({}): {}",
                        job.getId(), e.getReason(), e.getMessage());
                meterRegistry.counter("monitor.source.unavailable",
                        "reason", e.getReason().name()
                ).increment();
                return JobCheckResult.of(job.getId(), CheckOutcome.SOURCE_UNAVAILABLE, e.getMessage());
            }

            Instant now = info.getObservedAt() != null ? info.getObservedAt() : clock.instant();
            return trackingStore.withLock(job.getId(), () -> decideAndRecord(job, info, now));
        } finally {
            MDC.remove(MDC_JOB_ID_KEY);
        }
    }

    private JobCheckResult decideAndRecord(JobSpec job, ExecutionInfo info, Instant now) {
        JobTrackingRecord prior = trackingStore.snapshot(job.getId())
                .orElseGet(() -> JobTrackingRecord.initial(job.getId()));

        ConformanceDecision decision;
        try {
            decision = decider.decide(job, info, prior, now);
        } catch (ScheduleUnsatisfiableException e) {
            log.error("Cannot evaluate schedule of job '{}': {}", job.getId(), e.getMessage());
            meterRegistry.counter("monitor.schedule.errors").increment();
            return JobCheckResult.of(job.getId(), CheckOutcome.SCHEDULE_ERROR, e.getMessage());
        }

        if (Thread.currentThread().isInterrupted()) {
            log.info("Check of job '{}' abandoned before commit", job.getId());
            return JobCheckResult.of(job.getId(), CheckOutcome.ERROR, "Check interrupted");
        }

        JobTrackingRecord record = decision.getRecord();
        trackingStore.replace(job.getId(), record);
        logDecision(job, info, decision);

        DispatchResult dispatchResult = null;
        if (decision.getIncident() != null) {
            meterRegistry.counter("monitor.incidents",
                    "kind", decision.getIncident().getKind().name()
            ).increment();
            dispatchResult = alertDispatcher.dispatch(decision.getIncident(), record);
        }

        return JobCheckResult.builder()
                .jobId(job.getId())
                .outcome(decision.getOutcome())
                .incident(decision.getIncident())
                .dispatchResult(dispatchResult)
                .detail(decision.getIncident() != null ? decision.getIncident().getSummary() : null)
                .build();
    }

    private void logDecision(JobSpec job, ExecutionInfo info, ConformanceDecision decision) {
        if (info.hasBuild()) {
            log.info("Job '{}' - Last build #{} at {} was {}, expected at {} -> {}",
                    job.getId(),
                    info.getLastBuildNumber(),
                    TimeUtils.formatInstant(info.getLastBuildTime()),
                    info.getLastBuildStatus(),
                    TimeUtils.formatInstant(decision.getDue()),
                    decision.getOutcome());
        } else {
            log.info("Job '{}' - no builds, expected at {} -> {}",
                    job.getId(), TimeUtils.formatInstant(decision.getDue()), decision.getOutcome());
        }

        switch (decision.getOutcome()) {
            case MISSED:
                log.warn("Job '{}' hasn't run since expected time {} (threshold: {} minutes)",
                        job.getId(), TimeUtils.formatInstant(decision.getDue()),
                        job.getAlertThreshold().toMinutes());
                break;
            case FAILED:
                log.warn("Job '{}' build #{} finished with status {}",
                        job.getId(), info.getLastBuildNumber(), info.getLastBuildStatus());
                break;
            case PENDING:
                log.debug("Job '{}' behind schedule for {} consecutive checks, still within threshold",
                        job.getId(), decision.getRecord().getConsecutiveMissCount());
                break;
            default:
                break;
        }
    }
}
