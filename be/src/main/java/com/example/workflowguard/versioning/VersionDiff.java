package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.List;

public record VersionDiff(
        String fromVersionId,
        String toVersionId,
        List<WorkflowNode> addedNodes,
        List<WorkflowNode> removedNodes,
        List<NodeChange> modifiedNodes,
        List<WorkflowEdge> addedEdges,
        List<WorkflowEdge> removedEdges,
        List<EdgeChange> modifiedEdges,
        DiffSummary summary
) {
    public VersionDiff {
        addedNodes = List.copyOf(addedNodes);
        removedNodes = List.copyOf(removedNodes);
        modifiedNodes = List.copyOf(modifiedNodes);
        addedEdges = List.copyOf(addedEdges);
        removedEdges = List.copyOf(removedEdges);
        modifiedEdges = List.copyOf(modifiedEdges);
    }

    public boolean isEmpty() {
        return summary.totalChanges() == 0;
    }
}
