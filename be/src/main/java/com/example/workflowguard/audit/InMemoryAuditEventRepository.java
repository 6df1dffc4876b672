package com.example.workflowguard.audit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory trail: once {@code maxEvents} is reached, each append evicts the oldest event.
 */
public class InMemoryAuditEventRepository implements AuditEventRepository {

    public static final int DEFAULT_MAX_EVENTS = 10_000;

    private final int maxEvents;
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    public InMemoryAuditEventRepository(int maxEvents) {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be at least 1");
        }
        this.maxEvents = maxEvents;
    }

    @Override
    public synchronized void append(AuditEvent event) {
        events.addLast(event);
        while (events.size() > maxEvents) {
            events.removeFirst();
        }
    }

    @Override
    public synchronized List<AuditEvent> findAll() {
        return List.copyOf(events);
    }

    @Override
    public synchronized int size() {
        return events.size();
    }
}
