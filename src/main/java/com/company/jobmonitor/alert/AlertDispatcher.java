package com.company.jobmonitor.alert;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.domain.enums.IncidentKind;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * De-duplicates incidents and hands the survivors to every notification sink.
 * <p>
 * An incident is suppressed when an alert of the same kind was sent for the same
 * job within the suppression window. Bookkeeping lives on the job's tracking
 * record; the caller must hold that job's lock. Delivery is at most once: the
 * record is stamped before sending and a failed send is neither rolled back nor
 * retried.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final List<NotificationSink> sinks;
    private final MonitorProperties.Alerts config;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AlertDispatcher(List<NotificationSink> sinks,
                           MonitorProperties properties,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.config = properties.getAlerts();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        log.info("Alert channels: {}", sinks.stream().map(NotificationSink::name).collect(Collectors.toList()));
    }

    public DispatchResult dispatch(Incident incident, JobTrackingRecord record) {
        Instant now = clock.instant();

        if (incident.getKind() == IncidentKind.RECOVERED) {
            record.clearSuppression();
            if (!config.isNotifyRecovery()) {
                log.debug("Suppression cleared for job '{}' (recovery notifications disabled)", incident.getJobId());
                return DispatchResult.CLEARED;
            }
            return deliver(incident) ? DispatchResult.SENT : DispatchResult.FAILED;
        }

        if (isSuppressed(incident, record, now)) {
            log.debug("Alert suppressed for job '{}' - {} already sent at {}",
                    incident.getJobId(), incident.getKind(), record.getLastAlertSentAt());
            meterRegistry.counter("monitor.alerts.suppressed",
                    "kind", incident.getKind().name()
            ).increment();
            return DispatchResult.SUPPRESSED;
        }

        record.setLastAlertKindSent(incident.getKind());
        record.setLastAlertSentAt(now);

        return deliver(incident) ? DispatchResult.SENT : DispatchResult.FAILED;
    }

    boolean isSuppressed(Incident incident, JobTrackingRecord record, Instant now) {
        if (record.getLastAlertKindSent() != incident.getKind() || record.getLastAlertSentAt() == null) {
            return false;
        }
        Duration sinceLast = Duration.between(record.getLastAlertSentAt(), now);
        return sinceLast.compareTo(config.getSuppressionWindow()) < 0;
    }

    private boolean deliver(Incident incident) {
        boolean delivered = true;
        for (NotificationSink sink : sinks) {
            try {
                sink.send(incident);
                meterRegistry.counter("monitor.alerts.sent",
                        "kind", incident.getKind().name(),
                        "channel", sink.name()
                ).increment();
            } catch (RuntimeException e) {
                delivered = false;
                log.error("Failed to send {} alert for job '{}' via {}",
                        incident.getKind(), incident.getJobId(), sink.name(), e);
                meterRegistry.counter("monitor.alerts.failed",
                        "kind", incident.getKind().name(),
                        "channel", sink.name()
                ).increment();
            }
        }
        return delivered;
    }
}
