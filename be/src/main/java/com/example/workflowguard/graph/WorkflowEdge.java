package com.example.workflowguard.graph;

/**
 * Directed connection between two nodes. {@code source} and {@code target} are soft references: an edge may
 * point at an id that does not exist, which the schema validator reports.
 */
public record WorkflowEdge(String id, String source, String target, String sourceHandle, String targetHandle) {

    public static WorkflowEdge of(String id, String source, String target) {
        return new WorkflowEdge(id, source, target, null, null);
    }
}
