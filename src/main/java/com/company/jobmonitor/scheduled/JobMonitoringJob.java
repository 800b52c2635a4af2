package com.company.jobmonitor.scheduled;

import com.company.jobmonitor.config.JobCatalog;
import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.JobCheckResult;
import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import com.company.jobmonitor.service.ConformanceEngine;
import com.company.jobmonitor.store.JobTrackingStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * MONITORING CYCLE (every minute by default)
 * Checks every enabled job in parallel on the monitor worker pool.
 * <p>
 * A job whose previous check is still running is skipped for this cycle, so no
 * two checks of one job are ever in flight together. Each check is bounded by
 * {@code monitor.check-timeout}, counted from when its task starts and never from
 * when the cycle gets round to waiting for it; a check that runs over is reported
 * as source unavailable and interrupted.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "monitor.scheduling.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class JobMonitoringJob {

    private final JobCatalog catalog;
    private final ConformanceEngine engine;
    private final JobTrackingStore trackingStore;
    private final SourceHealthTracker sourceHealth;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration checkTimeout;

    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JobMonitoringJob(JobCatalog catalog,
                            ConformanceEngine engine,
                            JobTrackingStore trackingStore,
                            SourceHealthTracker sourceHealth,
                            ExecutorService monitorExecutor,
                            MonitorProperties properties,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.catalog = catalog;
        this.engine = engine;
        this.trackingStore = trackingStore;
        this.sourceHealth = sourceHealth;
        this.executor = monitorExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.checkTimeout = properties.getCheckTimeout();
    }

    @Scheduled(
            fixedDelayString = "${monitor.scheduling.interval-ms:60000}",
            initialDelayString = "${monitor.scheduling.initial-delay-ms:5000}"
    )
    public void runScheduledCycle() {
        try {
            monitorJobs();
        } catch (RuntimeException e) {
            log.error("Job monitoring cycle failed", e);
            meterRegistry.counter("monitor.cycle.failures").increment();
        }
    }

    public CycleSummary monitorJobs() {
        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);

        List<JobSpec> jobs = catalog.enabledJobs();
        Set<String> enabledIds = jobs.stream().map(JobSpec::getId).collect(Collectors.toSet());
        int dropped = trackingStore.retainOnly(enabledIds);
        sourceHealth.retainOnly(enabledIds);
        if (dropped > 0) {
            log.info("Dropped tracking state of {} jobs no longer monitored", dropped);
        }

        log.info("Starting monitoring cycle for {} jobs", jobs.size());

        CycleSummary.CycleSummaryBuilder summary = CycleSummary.builder().startedAt(startedAt);
        Map<String, PendingCheck> pending = new LinkedHashMap<>();

        for (JobSpec job : jobs) {
            if (!inFlight.add(job.getId())) {
                log.warn("Previous check of job '{}' still running, skipping this cycle", job.getId());
                meterRegistry.counter("monitor.checks.skipped").increment();
                summary.skippedJob(job.getId());
                continue;
            }
            try {
                pending.put(job.getId(), submit(job));
            } catch (RejectedExecutionException e) {
                inFlight.remove(job.getId());
                log.error("Could not schedule check of job '{}'", job.getId(), e);
                summary.result(JobCheckResult.of(job.getId(), CheckOutcome.ERROR, "Worker pool rejected the check"));
            }
        }

        for (Map.Entry<String, PendingCheck> entry : pending.entrySet()) {
            JobCheckResult result = await(entry.getKey(), entry.getValue());
            sourceHealth.record(result.getJobId(), result.getOutcome());
            meterRegistry.counter("monitor.checks", "outcome", result.getOutcome().name()).increment();
            summary.result(result);
        }

        Duration duration = Duration.ofNanos(sample.stop(meterRegistry.timer("monitor.cycle.duration")));
        CycleSummary result = summary.duration(duration).build();

        log.info("Monitoring cycle completed in {}ms: {} checked, {} incidents, {} missed, {} failed, "
                        + "{} source unavailable, {} skipped",
                duration.toMillis(),
                result.getResults().size(),
                result.incidentCount(),
                result.count(CheckOutcome.MISSED),
                result.count(CheckOutcome.FAILED),
                result.count(CheckOutcome.SOURCE_UNAVAILABLE),
                result.getSkippedJobs().size());

        return result;
    }

    /** Whether a check of the job is currently running. */
    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    private PendingCheck submit(JobSpec job) {
        // Whoever claims first releases the in-flight slot: the task when it starts,
        // or the cycle when it gives up on a task that never started.
        AtomicBoolean claimed = new AtomicBoolean();
        AtomicLong startedAt = new AtomicLong(NOT_STARTED);
        long submittedAt = System.nanoTime();
        Future<JobCheckResult> future = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return JobCheckResult.of(job.getId(), CheckOutcome.ERROR, "Check abandoned before start");
            }
            startedAt.set(System.nanoTime());
            try {
                return engine.check(job);
            } finally {
                inFlight.remove(job.getId());
            }
        });
        return new PendingCheck(future, claimed, submittedAt, startedAt);
    }

    /**
     * Waits for one check until its own deadline: the check timeout counted from
     * when the task started, or from submission while it is still queued.
     */
    private JobCheckResult await(String jobId, PendingCheck check) {
        try {
            while (true) {
                long remaining = check.deadline(checkTimeout) - System.nanoTime();
                try {
                    return check.future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    // the task may have started after the deadline was read
                    if (check.deadline(checkTimeout) - System.nanoTime() <= 0) {
                        return timedOut(jobId, check);
                    }
                }
            }
        } catch (ExecutionException e) {
            log.error("Check of job '{}' failed unexpectedly", jobId, e.getCause());
            return JobCheckResult.of(jobId, CheckOutcome.ERROR, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(jobId, check);
            return JobCheckResult.of(jobId, CheckOutcome.ERROR, "Monitoring cycle interrupted");
        }
    }

    private JobCheckResult timedOut(String jobId, PendingCheck check) {
        abandon(jobId, check);
        log.warn("Check of job '{}' timed out after {}ms", jobId, checkTimeout.toMillis());
        return JobCheckResult.of(jobId, CheckOutcome.SOURCE_UNAVAILABLE,
                "Check timed out after " + checkTimeout.toMillis() + "ms");
    }

    private void abandon(String jobId, PendingCheck check) {
        check.future.cancel(true);
        if (check.claimed.compareAndSet(false, true)) {
            inFlight.remove(jobId);
        }
    }

    private static final class PendingCheck {
        private final Future<JobCheckResult> future;
        private final AtomicBoolean claimed;
        private final long submittedAt;
        private final AtomicLong startedAt;

        private PendingCheck(Future<JobCheckResult> future, AtomicBoolean claimed,
                             long submittedAt, AtomicLong startedAt) {
            this.future = future;
            this.claimed = claimed;
            this.submittedAt = submittedAt;
            this.startedAt = startedAt;
        }

        private long deadline(Duration timeout) {
            long started = startedAt.get();
            return (started == NOT_STARTED ? submittedAt : started) + timeout.toNanos();
        }
    }
}
