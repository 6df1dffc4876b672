package com.example.workflowguard.versioning;

/**
 * Lifecycle state of a stored version. At most one version per workflow is {@link #ACTIVE}.
 */
public enum VersionStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED,
    DEPRECATED
}
