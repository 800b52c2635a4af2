package com.company.jobmonitor.alert;

import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.domain.enums.IncidentKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to the application log. Always active, so alerts stay visible
 * when no e-mail channel is configured.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoggingNotificationSink implements NotificationSink {

    private final IncidentFormatter formatter;

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(Incident incident) {
        if (incident.getKind() == IncidentKind.RECOVERED) {
            log.info("ALERT {}: {}", formatter.subject(incident), incident.getSummary());
            return;
        }
        log.warn("ALERT {}: {}", formatter.subject(incident), incident.getSummary());
        log.debug("Alert body:\n{}", formatter.body(incident));
    }
}
