package com.example.workflowguard.audit;

import java.time.Instant;

/**
 * Inclusive time window; a null bound leaves that side open.
 */
public record TimeRange(Instant from, Instant to) {

    public static final TimeRange ALL = new TimeRange(null, null);

    public TimeRange {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
    }

    public boolean contains(Instant instant) {
        return (from == null || !instant.isBefore(from)) && (to == null || !instant.isAfter(to));
    }
}
