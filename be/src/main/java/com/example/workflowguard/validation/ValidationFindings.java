package com.example.workflowguard.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings collected by one validation stage.
 */
public record ValidationFindings(List<ValidationError> errors, List<ValidationWarning> warnings) {

    public ValidationFindings {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationFindings of(List<ValidationError> errors) {
        return new ValidationFindings(errors, List.of());
    }

    public ValidationFindings plus(ValidationFindings other) {
        List<ValidationError> allErrors = new ArrayList<>(errors);
        allErrors.addAll(other.errors());
        List<ValidationWarning> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings());
        return new ValidationFindings(allErrors, allWarnings);
    }
}
