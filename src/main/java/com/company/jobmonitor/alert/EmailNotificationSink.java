package com.company.jobmonitor.alert;

import com.company.jobmonitor.config.MonitorProperties;
import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.exception.SinkException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(value = "monitor.alerts.email.enabled", havingValue = "true")
public class EmailNotificationSink implements NotificationSink {

    private final JavaMailSender mailSender;
    private final IncidentFormatter formatter;
    private final Tracer tracer;
    private final MonitorProperties.Email config;

    public EmailNotificationSink(JavaMailSender monitorMailSender,
                                 IncidentFormatter formatter,
                                 Tracer tracer,
                                 MonitorProperties properties) {
        this.mailSender = monitorMailSender;
        this.formatter = formatter;
        this.tracer = tracer;
        this.config = properties.getAlerts().getEmail();
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public void send(Incident incident) {
        Span span = tracer.spanBuilder("monitor.alert.send")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("job.id", incident.getJobId());
            span.setAttribute("incident.kind", incident.getKind().name());
            span.setAttribute("alert.channel", name());
            span.setAttribute("alert.recipients", config.getTo().size());

            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(config.getFrom());
            message.setTo(config.getTo().toArray(new String[0]));
            message.setSubject(formatter.subject(incident));
            message.setText(formatter.body(incident));

            log.info("Sending email alert: {}", message.getSubject());
            mailSender.send(message);
            log.info("Alert email sent for job '{}'", incident.getJobId());

        } catch (MailException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send email");
            throw new SinkException("Failed to send email alert for job '" + incident.getJobId() + "'", e);
        } finally {
            span.end();
        }
    }
}
