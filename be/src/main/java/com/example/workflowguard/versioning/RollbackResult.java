package com.example.workflowguard.versioning;

import java.util.List;
import java.util.Optional;

/**
 * @param backup   the backup snapshot, or null when none was requested or there was no active version
 * @param warnings compatibility warnings; empty when there are none
 */
public record RollbackResult(boolean success, WorkflowVersion rolledBackTo, WorkflowVersion backup, List<String> warnings) {

    public RollbackResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<WorkflowVersion> backupVersion() {
        return Optional.ofNullable(backup);
    }
}
