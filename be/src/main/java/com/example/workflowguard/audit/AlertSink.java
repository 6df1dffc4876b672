package com.example.workflowguard.audit;

/**
 * Receives high and critical security events for out-of-band delivery. Called on the auditing thread, so
 * implementations should hand the event off rather than block.
 */
@FunctionalInterface
public interface AlertSink {

    void alert(AuditEvent event);
}
