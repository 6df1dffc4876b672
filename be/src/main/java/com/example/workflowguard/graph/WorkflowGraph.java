package com.example.workflowguard.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable workflow graph: nodes plus directed edges.
 */
public record WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {

    public WorkflowGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static WorkflowGraph empty() {
        return new WorkflowGraph(List.of(), List.of());
    }

    public Optional<WorkflowNode> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream().filter(n -> nodeId.equals(n.id())).findFirst();
    }

    public Set<String> nodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (WorkflowNode node : nodes) {
            if (node.id() != null) {
                ids.add(node.id());
            }
        }
        return ids;
    }

    public List<WorkflowNode> triggerNodes() {
        return nodes.stream().filter(WorkflowNode::isTrigger).toList();
    }

    public WorkflowGraph withNodes(List<WorkflowNode> newNodes) {
        return new WorkflowGraph(newNodes, edges);
    }

    public WorkflowGraph withAddedEdges(List<WorkflowEdge> added) {
        Objects.requireNonNull(added, "added");
        List<WorkflowEdge> all = new ArrayList<>(edges);
        all.addAll(added);
        return new WorkflowGraph(nodes, all);
    }
}
