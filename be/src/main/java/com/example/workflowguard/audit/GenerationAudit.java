package com.example.workflowguard.audit;

import lombok.Builder;

/**
 * Outcome of one generation run as reported to {@link AuditLog#logWorkflowGeneration}.
 *
 * @param errorMessage failure cause when {@code outcome} is {@link Outcome#FAILURE}; may be null
 */
@Builder
public record GenerationAudit(
        String userId,
        String sessionId,
        String workflowId,
        String prompt,
        Outcome outcome,
        int nodeCount,
        int edgeCount,
        int errorCount,
        int warningCount,
        int autoCorrections,
        long durationMs,
        String errorMessage
) {
}
