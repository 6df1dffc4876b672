package com.example.workflowguard.security;

import java.util.List;

/**
 * @param sanitizedCode code with critical constructs replaced by a blocking marker, or null when unchanged
 */
public record CodeScanResult(boolean safe, List<SecurityIssue> issues, String sanitizedCode) {

    public CodeScanResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public RiskLevel highestSeverity() {
        return issues.stream().map(SecurityIssue::severity).max(Enum::compareTo).orElse(RiskLevel.LOW);
    }
}
