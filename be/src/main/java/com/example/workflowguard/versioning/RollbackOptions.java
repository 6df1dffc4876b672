package com.example.workflowguard.versioning;

import lombok.Builder;

/**
 * @param createBackup snapshot the currently active content as a new version before switching
 */
@Builder
public record RollbackOptions(String performedBy, String reason, boolean createBackup) {
}
