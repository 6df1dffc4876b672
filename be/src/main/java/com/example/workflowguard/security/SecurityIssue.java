package com.example.workflowguard.security;

import java.util.Objects;

/**
 * @param location matched text (shortened), or null when the detector reports the input as a whole
 */
public record SecurityIssue(IssueType type, RiskLevel severity, String description, String location, String suggestion) {

    public SecurityIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
    }
}
