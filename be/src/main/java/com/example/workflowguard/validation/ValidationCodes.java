package com.example.workflowguard.validation;

/**
 * Stable codes carried by {@link ValidationError} and {@link ValidationWarning}.
 */
public final class ValidationCodes {

    public static final String SCHEMA_VALIDATION_ERROR = "SCHEMA_VALIDATION_ERROR";
    public static final String MISSING_ID = "MISSING_ID";
    public static final String MISSING_POSITION = "MISSING_POSITION";

    public static final String NO_TRIGGER_NODE = "NO_TRIGGER_NODE";
    public static final String TOO_MANY_TRIGGERS = "TOO_MANY_TRIGGERS";
    public static final String MISSING_REQUIRED_CONFIG = "MISSING_REQUIRED_CONFIG";
    public static final String INCOMPATIBLE_CONNECTION = "INCOMPATIBLE_CONNECTION";

    public static final String INVALID_EDGE_REFERENCE = "INVALID_EDGE_REFERENCE";
    public static final String CYCLE_DETECTED = "CYCLE_DETECTED";
    public static final String UNREACHABLE_NODES = "UNREACHABLE_NODES";
    public static final String ORPHANED_NODES = "ORPHANED_NODES";

    public static final String UNSAFE_CODE_DETECTED = "UNSAFE_CODE_DETECTED";
    public static final String SUSPICIOUS_CODE = "SUSPICIOUS_CODE";
    public static final String SENSITIVE_CONFIG = "SENSITIVE_CONFIG";

    private ValidationCodes() {
        throw new AssertionError("Utility class");
    }
}
