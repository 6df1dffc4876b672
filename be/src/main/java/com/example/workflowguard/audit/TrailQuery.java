package com.example.workflowguard.audit;

import lombok.Builder;

import java.util.Set;

/**
 * Filter for {@link AuditLog#getUserAuditTrail}. Empty {@code eventTypes} means all types.
 */
@Builder
public record TrailQuery(TimeRange range, Set<AuditEventType> eventTypes, int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public TrailQuery {
        range = range == null ? TimeRange.ALL : range;
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }
}
