package com.example.workflowguard.security;

import java.util.List;

/**
 * @param sanitizedText the cleaned prompt, or null when nothing had to change
 */
public record PromptScanResult(boolean secure, List<SecurityIssue> issues, String sanitizedText) {

    public PromptScanResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /** Text to forward downstream: the sanitized form when there is one. */
    public String effectiveText(String original) {
        return sanitizedText != null ? sanitizedText : original;
    }

    public RiskLevel highestSeverity() {
        return issues.stream().map(SecurityIssue::severity).max(Enum::compareTo).orElse(RiskLevel.LOW);
    }
}
