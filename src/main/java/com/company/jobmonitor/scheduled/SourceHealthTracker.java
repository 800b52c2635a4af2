package com.company.jobmonitor.scheduled;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts consecutive checks per job for which Jenkins could not be read.
 * <p>
 * Crossing the configured threshold produces one operational warning, logged
 * once per streak. It is never a missed-schedule alert and does not touch the
 * job's tracking record.
 */
@Component
@Slf4j
public class SourceHealthTracker {

    private final ConcurrentMap<String, AtomicInteger> failureStreaks = new ConcurrentHashMap<>();
    private final int warningThreshold;

    public SourceHealthTracker(MonitorProperties properties, MeterRegistry meterRegistry) {
        this.warningThreshold = properties.getAlerts().getSourceUnavailableWarningAfter();

        Gauge.builder("monitor.source.unreachable.jobs", this, SourceHealthTracker::unreachableJobCount)
                .description("Jobs whose execution source has been unavailable for at least the warning threshold")
                .register(meterRegistry);
    }

    public void record(String jobId, CheckOutcome outcome) {
        if (outcome == CheckOutcome.SOURCE_UNAVAILABLE) {
            int streak = failureStreaks.computeIfAbsent(jobId, id -> new AtomicInteger()).incrementAndGet();
            if (streak == warningThreshold) {
                log.warn("OPERATIONAL WARNING: Jenkins unavailable for job '{}' on {} consecutive checks; "
                        + "schedule conformance is not being evaluated", jobId, streak);
            }
            return;
        }

        AtomicInteger previous = failureStreaks.remove(jobId);
        if (previous != null && previous.get() >= warningThreshold) {
            log.info("Jenkins reachable again for job '{}' after {} failed checks", jobId, previous.get());
        }
    }

    public int consecutiveFailures(String jobId) {
        AtomicInteger streak = failureStreaks.get(jobId);
        return streak == null ? 0 : streak.get();
    }

    public boolean isUnreachable(String jobId) {
        return consecutiveFailures(jobId) >= warningThreshold;
    }

    public Map<String, Integer> snapshot() {
        Map<String, Integer> result = new TreeMap<>();
        failureStreaks.forEach((jobId, streak) -> result.put(jobId, streak.get()));
        return result;
    }

    public void retainOnly(Set<String> jobIds) {
        failureStreaks.keySet().retainAll(jobIds);
    }

    int unreachableJobCount() {
        return (int) failureStreaks.values().stream()
                .filter(streak -> streak.get() >= warningThreshold)
                .count();
    }
}
