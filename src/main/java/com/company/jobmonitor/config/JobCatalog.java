package com.company.jobmonitor.config;

import com.company.jobmonitor.domain.JobSpec;
import com.company.jobmonitor.exception.MonitorConfigException;
import com.company.jobmonitor.exception.ScheduleUnsatisfiableException;
import com.company.jobmonitor.schedule.CronSchedule;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Validated, immutable set of jobs to watch. Construction fails fast on any
 * configuration problem.
 */
@Slf4j
public class JobCatalog {

    private final Map<String, JobSpec> jobs;

    public JobCatalog(List<JobSpec> specs) {
        Map<String, JobSpec> byId = new LinkedHashMap<>();
        for (JobSpec spec : specs) {
            if (byId.putIfAbsent(spec.getId(), spec) != null) {
                throw new MonitorConfigException("Duplicate job name: " + spec.getId());
            }
        }
        this.jobs = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds the catalog from bound properties, validating the Jenkins endpoint,
     * every job and, when enabled, the e-mail channel.
     *
     * @throws MonitorConfigException on the first invalid setting
     */
    public static JobCatalog fromProperties(MonitorProperties properties, Clock clock) {
        validateJenkins(properties.getJenkins());
        validateEmail(properties.getAlerts().getEmail());

        List<MonitorProperties.Job> configured = properties.getJobs();
        if (configured == null || configured.isEmpty()) {
            throw new MonitorConfigException("At least one job must be configured under monitor.jobs");
        }

        List<JobSpec> specs = new ArrayList<>();
        for (MonitorProperties.Job job : configured) {
            specs.add(toSpec(job, clock));
        }

        JobCatalog catalog = new JobCatalog(specs);
        log.info("Loaded {} jobs ({} enabled)", catalog.size(), catalog.enabledJobs().size());
        return catalog;
    }

    static JobSpec toSpec(MonitorProperties.Job job, Clock clock) {
        String name = job.getName() == null ? "" : job.getName().trim();
        if (name.isEmpty()) {
            throw new MonitorConfigException("Job name cannot be empty");
        }
        if (name.startsWith("/") || name.endsWith("/") || name.contains("//")) {
            throw new MonitorConfigException("Job name '" + name + "' has an empty folder segment");
        }

        Duration threshold = job.getAlertThreshold();
        if (threshold == null || threshold.isNegative()) {
            throw new MonitorConfigException("Alert threshold for job '" + name + "' must not be negative");
        }

        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(CronNormalizer.normalize(job.getExpectedSchedule()));
        } catch (MonitorConfigException e) {
            throw new MonitorConfigException(
                    "Invalid cron expression for job '" + name + "': " + e.getMessage(), e);
        }

        try {
            schedule.mostRecentDue(clock.instant());
        } catch (ScheduleUnsatisfiableException e) {
            throw new MonitorConfigException(
                    "Schedule for job '" + name + "' never matches: " + job.getExpectedSchedule(), e);
        }

        return JobSpec.builder()
                .id(name)
                .cronExpression(job.getExpectedSchedule().trim())
                .schedule(schedule)
                .alertThreshold(threshold)
                .enabled(job.isEnabled())
                .build();
    }

    private static void validateJenkins(MonitorProperties.Jenkins jenkins) {
        String url = jenkins.getUrl();
        if (url == null || url.isBlank()) {
            throw new MonitorConfigException("Jenkins URL cannot be empty (monitor.jenkins.url)");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new MonitorConfigException("Jenkins URL must be an absolute http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new MonitorConfigException("Invalid Jenkins URL: " + url, e);
        }
        if (jenkins.getTimeout() == null || jenkins.getTimeout().isZero() || jenkins.getTimeout().isNegative()) {
            throw new MonitorConfigException("Jenkins timeout must be positive");
        }
    }

    private static void validateEmail(MonitorProperties.Email email) {
        if (!email.isEnabled()) {
            return;
        }
        if (email.getSmtpHost() == null || email.getSmtpHost().isBlank()) {
            throw new MonitorConfigException("E-mail alerts enabled but monitor.alerts.email.smtp-host is missing");
        }
        if (email.getFrom() == null || email.getFrom().isBlank()) {
            throw new MonitorConfigException("E-mail alerts enabled but monitor.alerts.email.from is missing");
        }
        if (email.getTo() == null || email.getTo().isEmpty()) {
            throw new MonitorConfigException("E-mail alerts enabled but no recipient is configured");
        }
    }

    public List<JobSpec> allJobs() {
        return List.copyOf(jobs.values());
    }

    public List<JobSpec> enabledJobs() {
        return jobs.values().stream()
                .filter(JobSpec::isEnabled)
                .collect(Collectors.toList());
    }

    public Optional<JobSpec> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public int size() {
        return jobs.size();
    }
}
