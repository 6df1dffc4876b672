package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;

import java.util.List;

/**
 * @param changedFields names of the differing fields: source, target, sourceHandle, targetHandle
 */
public record EdgeChange(String edgeId, List<String> changedFields, WorkflowEdge before, WorkflowEdge after) {

    public EdgeChange {
        changedFields = List.copyOf(changedFields);
    }
}
