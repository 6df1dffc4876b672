package com.example.workflowguard.audit;

import com.example.workflowguard.security.RiskLevel;
import lombok.Builder;

/**
 * @param violationType short category such as {@code PROMPT_INJECTION}; used for the report's top types
 * @param input         offending input; stored sanitized and truncated
 */
@Builder
public record SecurityViolation(
        String userId,
        String sessionId,
        String violationType,
        RiskLevel severity,
        String description,
        String input,
        String resource
) {
}
