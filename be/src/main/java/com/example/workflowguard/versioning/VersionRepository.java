package com.example.workflowguard.versioning;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for workflow versions. Implementations must be safe for concurrent use; the
 * {@link VersionStore} serializes mutations per workflow on top of it.
 */
public interface VersionRepository {

    /** Inserts the version, or replaces the stored one with the same id. */
    void save(WorkflowVersion version);

    Optional<WorkflowVersion> findById(String versionId);

    /** All versions of the workflow, ordered by version number ascending. */
    List<WorkflowVersion> findByWorkflowId(String workflowId);

    boolean deleteById(String versionId);

    /**
     * Highest version number ever saved for the workflow, deleted versions included, or 0 when none was.
     * Durable implementations must persist this high-water mark alongside the versions.
     */
    int highestVersionNumber(String workflowId);
}
