package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowNode;

import java.util.List;

/**
 * A node present in both versions whose compared fields differ.
 *
 * @param changedFields names of the differing fields, in a fixed order: label, blockType, config, position
 */
public record NodeChange(String nodeId, List<String> changedFields, WorkflowNode before, WorkflowNode after) {

    public NodeChange {
        changedFields = List.copyOf(changedFields);
    }
}
