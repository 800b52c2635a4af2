package com.company.jobmonitor.service;

import com.company.jobmonitor.domain.ExecutionInfo;
import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.domain.enums.BuildStatus;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import com.company.jobmonitor.domain.enums.FirstObservationPolicy;
import com.company.jobmonitor.domain.enums.IncidentKind;
import com.company.jobmonitor.domain.enums.JobHealthState;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;
import com.company.jobmonitor.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Schedule-conformance decision for one job at one instant.
 * <p>
 * Pure: the outcome depends only on the arguments, and the prior record is never
 * modified. The returned decision carries the record to commit.
 * <ol>
 *   <li>A failing terminal status not yet recorded for that build raises
 *       {@link IncidentKind#FAILED}, independently of the schedule.</li>
 *   <li>The job is compliant when its latest build started at or after the most
 *       recent due instant.</li>
 *   <li>A non-compliant job is missed only once {@code now - due} exceeds the
 *       alert threshold; before that it is pending and silent.</li>
 *   <li>Leaving a missed or failed state raises {@link IncidentKind#RECOVERED}.</li>
 * </ol>
 * The first check of a job only seeds its record.
 */
public class ConformanceDecider {

    private final FirstObservationPolicy firstObservationPolicy;

    public ConformanceDecider(FirstObservationPolicy firstObservationPolicy) {
        this.firstObservationPolicy = Objects.requireNonNull(firstObservationPolicy);
    }

    /**
     * @throws ScheduleUnsatisfiableException if the job's schedule has no due instant
     */
    public ConformanceDecision decide(JobSpec job, ExecutionInfo info, JobTrackingRecord prior, Instant now) {
        Instant due = job.getSchedule().mostRecentDue(now);
        boolean firstCheck = !prior.isSeeded();

        JobTrackingRecord next = prior.copy();
        next.setJobId(job.getId());
        next.setLastCheckedAt(now);
        next.setLastDueInstant(due);
        if (firstCheck) {
            next.setFirstObservedAt(now);
        }

        BuildStatus status = info.hasBuild() ? info.getLastBuildStatus() : BuildStatus.UNKNOWN;
        boolean newFailure = info.hasBuild() && status.isFailure() && !alreadyRecorded(prior, info);

        Instant latestBuild = latest(prior.getLastBuildTimeSeen(), info.getLastBuildTime());
        if (info.hasBuild()) {
            next.setLastBuildTimeSeen(latestBuild);
            next.setLastBuildStatusSeen(status);
            next.setLastBuildNumberSeen(info.getLastBuildNumber());
        }

        boolean compliant = latestBuild != null && !latestBuild.isBefore(due);
        boolean judged = isJudged(prior, firstCheck, due, latestBuild);
        Duration overdueBy = Duration.between(due, now);
        boolean missed = !compliant && judged && overdueBy.compareTo(job.getAlertThreshold()) > 0;

        if (compliant) {
            next.setConsecutiveMissCount(0);
        } else if (judged) {
            next.setConsecutiveMissCount(prior.getConsecutiveMissCount() + 1);
        }

        JobHealthState priorState = prior.getHealthState() == null ? JobHealthState.HEALTHY : prior.getHealthState();

        if (newFailure) {
            next.setHealthState(JobHealthState.FAILED);
            return new ConformanceDecision(CheckOutcome.FAILED,
                    failedIncident(job, info, due, now), next, due);
        }
        if (missed) {
            next.setHealthState(JobHealthState.MISSED);
            return new ConformanceDecision(CheckOutcome.MISSED,
                    missedIncident(job, info, latestBuild, due, now), next, due);
        }
        if (priorState.isIncident() && hasRecovered(priorState, status, compliant)) {
            next.setHealthState(JobHealthState.HEALTHY);
            return new ConformanceDecision(CheckOutcome.RECOVERED,
                    recoveredIncident(job, info, priorState, due, now), next, due);
        }

        next.setHealthState(priorState);
        CheckOutcome outcome;
        if (firstCheck) {
            outcome = CheckOutcome.SEEDED;
        } else {
            outcome = compliant ? CheckOutcome.COMPLIANT : CheckOutcome.PENDING;
        }
        return new ConformanceDecision(outcome, null, next, due);
    }

    /** Whether the failing status of this very build was already seen. */
    private boolean alreadyRecorded(JobTrackingRecord prior, ExecutionInfo info) {
        boolean sameBuild = info.getLastBuildNumber() != null
                ? info.getLastBuildNumber().equals(prior.getLastBuildNumberSeen())
                : Objects.equals(info.getLastBuildTime(), prior.getLastBuildTimeSeen());
        return sameBuild && prior.getLastBuildStatusSeen() == info.getLastBuildStatus();
    }

    private boolean isJudged(JobTrackingRecord prior, boolean firstCheck, Instant due, Instant latestBuild) {
        if (firstCheck) {
            return false;
        }
        if (firstObservationPolicy == FirstObservationPolicy.IMMEDIATE) {
            return true;
        }
        return latestBuild == null || !due.isBefore(prior.getFirstObservedAt());
    }

    private boolean hasRecovered(JobHealthState priorState, BuildStatus status, boolean compliant) {
        if (priorState == JobHealthState.MISSED) {
            return compliant && !status.isFailure();
        }
        return status.isSuccessful();
    }

    private Incident failedIncident(JobSpec job, ExecutionInfo info, Instant due, Instant now) {
        return baseIncident(job, info, IncidentKind.FAILED, due, now)
                .summary(String.format("Build #%s finished with status %s",
                        info.getLastBuildNumber() == null ? "?" : info.getLastBuildNumber(),
                        info.getLastBuildStatus()))
                .build();
    }

    private Incident missedIncident(JobSpec job, ExecutionInfo info, Instant latestBuild, Instant due, Instant now) {
        String summary = latestBuild == null
                ? String.format("Job has no builds and should have run at %s (overdue by %s, threshold %s)",
                        TimeUtils.formatInstant(due),
                        TimeUtils.formatDuration(Duration.between(due, now)),
                        TimeUtils.formatDuration(job.getAlertThreshold()))
                : String.format("Job has not run since %s; expected at %s (overdue by %s, threshold %s)",
                        TimeUtils.formatInstant(latestBuild),
                        TimeUtils.formatInstant(due),
                        TimeUtils.formatDuration(Duration.between(due, now)),
                        TimeUtils.formatDuration(job.getAlertThreshold()));
        return baseIncident(job, info, IncidentKind.MISSED, due, now)
                .lastBuildTime(latestBuild)
                .summary(summary)
                .build();
    }

    private Incident recoveredIncident(JobSpec job, ExecutionInfo info, JobHealthState priorState,
                                       Instant due, Instant now) {
        return baseIncident(job, info, IncidentKind.RECOVERED, due, now)
                .summary("Job recovered from " + priorState.name().toLowerCase() + " state")
                .build();
    }

    private Incident.IncidentBuilder baseIncident(JobSpec job, ExecutionInfo info, IncidentKind kind,
                                                  Instant due, Instant now) {
        return Incident.builder()
                .jobId(job.getId())
                .kind(kind)
                .detectedAt(now)
                .schedule(job.getCronExpression())
                .alertThreshold(job.getAlertThreshold())
                .expectedAt(due)
                .lastBuildTime(info.getLastBuildTime())
                .lastBuildNumber(info.getLastBuildNumber())
                .lastBuildStatus(info.hasBuild() ? info.getLastBuildStatus() : null)
                .lastBuildUrl(info.getLastBuildUrl());
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
