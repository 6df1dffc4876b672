package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a workflow graph. Only {@link #status()} changes over a version's life, by replacing the
 * record through {@link #withStatus(VersionStatus)}.
 */
public record WorkflowVersion(
        String id,
        String workflowId,
        int version,
        String name,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        VersionMetadata metadata,
        VersionStatus status,
        VersionChecksums checksums
) {
    public WorkflowVersion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(status, "status");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public WorkflowGraph graph() {
        return new WorkflowGraph(nodes, edges);
    }

    public boolean isActive() {
        return status == VersionStatus.ACTIVE;
    }

    public WorkflowVersion withStatus(VersionStatus newStatus) {
        return new WorkflowVersion(id, workflowId, version, name, nodes, edges, metadata, newStatus, checksums);
    }
}
