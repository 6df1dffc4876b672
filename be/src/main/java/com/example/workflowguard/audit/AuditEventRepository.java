package com.example.workflowguard.audit;

import java.util.List;

/**
 * Append-only storage port for audit events. Stored events are never modified.
 */
public interface AuditEventRepository {

    void append(AuditEvent event);

    /** Snapshot of the stored events, oldest first. */
    List<AuditEvent> findAll();

    int size();
}
