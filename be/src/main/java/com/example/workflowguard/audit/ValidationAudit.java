package com.example.workflowguard.audit;

import lombok.Builder;

@Builder
public record ValidationAudit(
        String userId,
        String sessionId,
        String workflowId,
        boolean valid,
        int errorCount,
        int warningCount,
        int autoCorrections,
        long durationMs
) {
}
