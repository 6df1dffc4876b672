package com.example.workflowguard.versioning;

import lombok.Getter;

/**
 * Thrown when a version id does not exist, or does not belong to the workflow it was requested for.
 */
@Getter
public class VersionNotFoundException extends RuntimeException {

    private final String workflowId;
    private final String versionId;

    public VersionNotFoundException(String workflowId, String versionId) {
        super(workflowId == null
                ? "Version not found: " + versionId
                : "Version not found: " + versionId + " (workflow " + workflowId + ")");
        this.workflowId = workflowId;
        this.versionId = versionId;
    }
}
