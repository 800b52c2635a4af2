package com.company.jobmonitor.scheduled;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.enums.CheckOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Source health tracking")
class SourceHealthTrackerTest {

    private SourceHealthTracker tracker;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.getAlerts().setSourceUnavailableWarningAfter(3);
        tracker = new SourceHealthTracker(properties, new SimpleMeterRegistry());
    }

    private void unavailable(String jobId, int times) {
        for (int i = 0; i < times; i++) {
            tracker.record(jobId, CheckOutcome.SOURCE_UNAVAILABLE);
        }
    }

    @Test
    @DisplayName("a job becomes unreachable only once the streak reaches the threshold")
    void threshold() {
        unavailable("a", 2);
        assertThat(tracker.isUnreachable("a")).isFalse();

        unavailable("a", 1);
        assertThat(tracker.isUnreachable("a")).isTrue();
        assertThat(tracker.consecutiveFailures("a")).isEqualTo(3);
        assertThat(tracker.unreachableJobCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("any other outcome ends the streak")
    void other_outcomes_reset() {
        unavailable("a", 4);

        tracker.record("a", CheckOutcome.MISSED);

        assertThat(tracker.consecutiveFailures("a")).isZero();
        assertThat(tracker.isUnreachable("a")).isFalse();
        assertThat(tracker.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("streaks are kept per job")
    void per_job() {
        unavailable("a", 3);
        unavailable("b", 1);

        assertThat(tracker.snapshot()).containsExactly(entry("a", 3), entry("b", 1));
        assertThat(tracker.unreachableJobCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("streaks of jobs no longer monitored are forgotten")
    void retain_only() {
        unavailable("a", 3);
        unavailable("b", 3);

        tracker.retainOnly(Set.of("b"));

        assertThat(tracker.snapshot()).containsOnlyKeys("b");
    }
}
