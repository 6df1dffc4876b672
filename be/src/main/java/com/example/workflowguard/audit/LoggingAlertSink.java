package com.example.workflowguard.audit;

import lombok.extern.slf4j.Slf4j;

/**
 * Default sink: writes the alert to the application log.
 */
@Slf4j
public class LoggingAlertSink implements AlertSink {

    @Override
    public void alert(AuditEvent event) {
        log.error("SECURITY ALERT eventId={} risk={} type={} user={} details={}",
                event.eventId(), event.risk(), event.eventType().value(), event.userId(), event.details());
    }
}
