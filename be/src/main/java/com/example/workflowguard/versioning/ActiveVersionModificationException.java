package com.example.workflowguard.versioning;

import lombok.Getter;

/**
 * Thrown when a caller tries to archive or delete the active version of a workflow.
 */
@Getter
public class ActiveVersionModificationException extends RuntimeException {

    private final String versionId;
    private final String operation;

    public ActiveVersionModificationException(String versionId, String operation) {
        super("Cannot " + operation + " active version: " + versionId);
        this.versionId = versionId;
        this.operation = operation;
    }
}
