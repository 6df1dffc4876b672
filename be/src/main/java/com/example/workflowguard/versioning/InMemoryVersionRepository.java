package com.example.workflowguard.versioning;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVersionRepository implements VersionRepository {

    private final Map<String, WorkflowVersion> versions = new ConcurrentHashMap<>();
    private final Map<String, Integer> highestVersionNumbers = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowVersion version) {
        versions.put(version.id(), version);
        highestVersionNumbers.merge(version.workflowId(), version.version(), Math::max);
    }

    @Override
    public Optional<WorkflowVersion> findById(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(versions.get(versionId));
    }

    @Override
    public List<WorkflowVersion> findByWorkflowId(String workflowId) {
        return versions.values().stream()
                .filter(v -> v.workflowId().equals(workflowId))
                .sorted(Comparator.comparingInt(WorkflowVersion::version))
                .toList();
    }

    @Override
    public boolean deleteById(String versionId) {
        return versionId != null && versions.remove(versionId) != null;
    }

    @Override
    public int highestVersionNumber(String workflowId) {
        return highestVersionNumbers.getOrDefault(workflowId, 0);
    }
}
