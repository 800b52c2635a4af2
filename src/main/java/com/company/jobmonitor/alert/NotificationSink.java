package com.company.jobmonitor.alert;

import com.company.jobmonitor.domain.Incident;
import com.company.jobmonitor.exception.SinkException;

/**
 * A channel alerts are delivered through (e-mail, log, ...).
 */
public interface NotificationSink {

    String name();

    /**
     * @throws SinkException if the channel could not deliver the alert
     */
    void send(Incident incident);
}
