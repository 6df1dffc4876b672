package com.example.workflowguard.validation;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A coded validation finding. Findings with severity {@link Severity#WARNING} can still appear here when a
 * stage wants them counted by strict mode or considered for auto-healing.
 *
 * @param field         path of the offending value, e.g. {@code nodes[n1].blockType}; may be null
 * @param missingFields required configuration fields that are absent (only for {@code MISSING_REQUIRED_CONFIG})
 */
@Builder
public record ValidationError(
        ErrorKind kind,
        String code,
        String message,
        String field,
        String nodeId,
        String edgeId,
        Severity severity,
        List<String> missingFields
) {
    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        severity = severity == null ? Severity.ERROR : severity;
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
