package com.company.jobmonitor.config;

import com.company.jobmonitor.domain.enums.FirstObservationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code monitor} prefix. Semantic validation happens in
 * {@link JobCatalog} so that every problem is reported as a configuration error
 * before the first check runs.
 */
@Data
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    private Jenkins jenkins = new Jenkins();
    private List<Job> jobs = new ArrayList<>();
    private Engine engine = new Engine();
    private Alerts alerts = new Alerts();
    private Scheduling scheduling = new Scheduling();
    private Tracing tracing = new Tracing();

    /** Per-job bound on a whole check, source call included. */
    private Duration checkTimeout = Duration.ofSeconds(45);

    private int workerThreads = 4;

    public int getWorkerThreads() {
        return Math.max(1, workerThreads);
    }

    @Data
    public static class Jenkins {
        private String url;
        private String username;
        private String apiToken;
        private Duration timeout = Duration.ofSeconds(30);
        private boolean verifyOnStartup = true;
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        public boolean hasCredentials() {
            return username != null && !username.isBlank()
                    && apiToken != null && !apiToken.isBlank();
        }
    }

    @Data
    public static class CircuitBreaker {
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 5;
        private Duration waitInOpenState = Duration.ofSeconds(60);
    }

    @Data
    public static class Job {
        private String name;
        private String expectedSchedule;
        private Duration alertThreshold = Duration.ofMinutes(60);
        private boolean enabled = true;
    }

    @Data
    public static class Engine {
        private FirstObservationPolicy firstObservationPolicy = FirstObservationPolicy.FULL_PERIOD;
    }

    @Data
    public static class Alerts {
        private Duration suppressionWindow = Duration.ofHours(1);
        private boolean notifyRecovery = true;
        /** Consecutive unavailable checks of one job before an operational warning. */
        private int sourceUnavailableWarningAfter = 5;
        private Email email = new Email();

        public int getSourceUnavailableWarningAfter() {
            return Math.max(1, sourceUnavailableWarningAfter);
        }
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String smtpHost;
        private int smtpPort = 587;
        private String from;
        private List<String> to = new ArrayList<>();
        private String username;
        private String password;
        private boolean starttls = true;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private long intervalMs = 60000;
        private long initialDelayMs = 5000;
    }

    @Data
    public static class Tracing {
        /** Initializes the OpenTelemetry SDK from the standard OTEL_* settings. */
        private boolean enabled = false;
    }
}
