package com.example.workflowguard.validation;

import java.util.Objects;

/**
 * Advisory finding that never affects {@link ValidationResult#valid()}.
 */
public record ValidationWarning(ErrorKind kind, String code, String message, String suggestion, String nodeId) {

    public ValidationWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public ValidationWarning(ErrorKind kind, String code, String message, String suggestion) {
        this(kind, code, message, suggestion, null);
    }
}
