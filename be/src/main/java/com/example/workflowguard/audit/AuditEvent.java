package com.example.workflowguard.audit;

import com.example.workflowguard.graph.WorkflowGraphJson;
import com.example.workflowguard.security.RiskLevel;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable entry of the audit trail. {@code details} holds sanitized, JSON-friendly values only.
 */
@Builder
public record AuditEvent(
        String eventId,
        AuditEventType eventType,
        Instant timestamp,
        String userId,
        String sessionId,
        String resource,
        String action,
        Map<String, Object> details,
        Outcome outcome,
        RiskLevel risk,
        EventMetadata metadata
) {
    public AuditEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(risk, "risk");
        details = WorkflowGraphJson.immutableMapCopy(details);
    }

    /** Numeric detail value, or 0 when absent or not a number. */
    public long detailAsLong(String key) {
        return details.get(key) instanceof Number number ? number.longValue() : 0L;
    }
}
