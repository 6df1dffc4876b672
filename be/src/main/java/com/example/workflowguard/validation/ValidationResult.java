package com.example.workflowguard.validation;

import com.example.workflowguard.graph.WorkflowGraph;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a pipeline run. {@code correctedGraph} is null unless the auto-healer changed something.
 */
public record ValidationResult(
        boolean valid,
        List<ValidationError> errors,
        List<ValidationWarning> warnings,
        WorkflowGraph correctedGraph
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<WorkflowGraph> corrected() {
        return Optional.ofNullable(correctedGraph);
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code))
                || warnings.stream().anyMatch(w -> w.code().equals(code));
    }

    public ValidationResult withCorrectedGraph(WorkflowGraph graph) {
        return new ValidationResult(valid, errors, warnings, graph);
    }
}
