package com.example.workflowguard.versioning;

/**
 * Per-workflow version statistics. Version numbers are null when the workflow has no (active) versions.
 */
public record VersionStats(
        int totalVersions,
        Integer activeVersion,
        Integer oldestVersion,
        Integer newestVersion,
        int archivedCount,
        int draftCount,
        double averageHoursBetweenVersions
) {
}
