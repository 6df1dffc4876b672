package com.example.workflowguard.audit;

public enum AuditEventType {
    WORKFLOW_GENERATION("workflow_generation"),
    WORKFLOW_VALIDATION("workflow_validation"),
    SECURITY_VIOLATION("security_violation"),
    BLOCK_GENERATION("block_generation"),
    PROMPT_INJECTION("prompt_injection"),
    CODE_EXECUTION("code_execution"),
    USER_ACTION("user_action"),
    SYSTEM_ERROR("system_error"),
    CONFIGURATION_CHANGE("configuration_change"),
    AUTH_EVENT("auth_event");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isSecurityRelated() {
        return this == SECURITY_VIOLATION || this == PROMPT_INJECTION;
    }
}
