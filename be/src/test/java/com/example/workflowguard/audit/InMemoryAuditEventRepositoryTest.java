package com.example.workflowguard.audit;

import com.example.workflowguard.security.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryAuditEventRepositoryTest {

    private static AuditEvent event(String id) {
        return AuditEvent.builder()
                .eventId(id)
                .eventType(AuditEventType.USER_ACTION)
                .timestamp(Instant.parse("2026-03-01T00:00:00Z"))
                .outcome(Outcome.SUCCESS)
                .risk(RiskLevel.LOW)
                .build();
    }

    @Test
    @DisplayName("evicts the oldest events beyond capacity")
    void evictsOldest() {
        InMemoryAuditEventRepository repository = new InMemoryAuditEventRepository(3);
        for (int i = 1; i <= 5; i++) {
            repository.append(event("e" + i));
        }

        assertEquals(3, repository.size());
        assertThat(repository.findAll()).extracting(AuditEvent::eventId).containsExactly("e3", "e4", "e5");
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void capacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryAuditEventRepository(0));
    }
}
