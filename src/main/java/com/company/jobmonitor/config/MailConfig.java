package com.company.jobmonitor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.Properties;

/**
 * SMTP transport for e-mail alerts, built from {@code monitor.alerts.email}.
 */
@Configuration
@ConditionalOnProperty(value = "monitor.alerts.email.enabled", havingValue = "true")
public class MailConfig {

    @Bean
    public JavaMailSender monitorMailSender(MonitorProperties properties) {
        MonitorProperties.Email email = properties.getAlerts().getEmail();

        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(email.getSmtpHost());
        sender.setPort(email.getSmtpPort());
        sender.setDefaultEncoding("UTF-8");

        boolean auth = email.getUsername() != null && !email.getUsername().isBlank();
        if (auth) {
            sender.setUsername(email.getUsername());
            sender.setPassword(email.getPassword());
        }

        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", String.valueOf(auth));
        props.put("mail.smtp.starttls.enable", String.valueOf(email.isStarttls()));
        props.put("mail.smtp.connectiontimeout", "30000");
        props.put("mail.smtp.timeout", "30000");
        props.put("mail.smtp.writetimeout", "30000");

        return sender;
    }
}
