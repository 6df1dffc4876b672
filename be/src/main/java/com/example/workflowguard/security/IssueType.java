package com.example.workflowguard.security;

public enum IssueType {
    PROMPT_INJECTION,
    CODE_INJECTION,
    SENSITIVE_DATA,
    MALICIOUS_PATTERN
}
