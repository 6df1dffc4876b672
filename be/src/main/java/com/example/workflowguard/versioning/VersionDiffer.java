package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraphJson;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Field-level comparison of two versions, matching nodes and edges by id.
 * <p>
 * A diff is significant when it has more than {@value #SIGNIFICANT_CHANGE_COUNT} changes, removes any node, or
 * changes the block type of any node.
 * </p>
 */
public final class VersionDiffer {

    static final int SIGNIFICANT_CHANGE_COUNT = 5;

    private VersionDiffer() {
    }

    public static VersionDiff compare(WorkflowVersion from, WorkflowVersion to) {
        Map<String, WorkflowNode> fromNodes = byId(from.nodes(), WorkflowNode::id);
        Map<String, WorkflowNode> toNodes = byId(to.nodes(), WorkflowNode::id);
        Map<String, WorkflowEdge> fromEdges = byId(from.edges(), WorkflowEdge::id);
        Map<String, WorkflowEdge> toEdges = byId(to.edges(), WorkflowEdge::id);

        List<WorkflowNode> addedNodes = missingFrom(toNodes, fromNodes);
        List<WorkflowNode> removedNodes = missingFrom(fromNodes, toNodes);
        List<NodeChange> modifiedNodes = new ArrayList<>();
        for (Map.Entry<String, WorkflowNode> entry : fromNodes.entrySet()) {
            WorkflowNode after = toNodes.get(entry.getKey());
            if (after != null) {
                List<String> fields = changedFields(entry.getValue(), after);
                if (!fields.isEmpty()) {
                    modifiedNodes.add(new NodeChange(entry.getKey(), fields, entry.getValue(), after));
                }
            }
        }

        List<WorkflowEdge> addedEdges = missingFrom(toEdges, fromEdges);
        List<WorkflowEdge> removedEdges = missingFrom(fromEdges, toEdges);
        List<EdgeChange> modifiedEdges = new ArrayList<>();
        for (Map.Entry<String, WorkflowEdge> entry : fromEdges.entrySet()) {
            WorkflowEdge after = toEdges.get(entry.getKey());
            if (after != null) {
                List<String> fields = changedFields(entry.getValue(), after);
                if (!fields.isEmpty()) {
                    modifiedEdges.add(new EdgeChange(entry.getKey(), fields, entry.getValue(), after));
                }
            }
        }

        int total = addedNodes.size() + removedNodes.size() + modifiedNodes.size()
                + addedEdges.size() + removedEdges.size() + modifiedEdges.size();
        boolean blockTypeChanged = modifiedNodes.stream().anyMatch(c -> c.changedFields().contains("blockType"));
        boolean significant = total > SIGNIFICANT_CHANGE_COUNT || !removedNodes.isEmpty() || blockTypeChanged;

        return new VersionDiff(from.id(), to.id(), addedNodes, removedNodes, modifiedNodes,
                addedEdges, removedEdges, modifiedEdges, new DiffSummary(total, significant));
    }

    static List<String> changedFields(WorkflowNode before, WorkflowNode after) {
        List<String> fields = new ArrayList<>();
        if (!Objects.equals(before.label(), after.label())) {
            fields.add("label");
        }
        if (!Objects.equals(before.blockType(), after.blockType())) {
            fields.add("blockType");
        }
        if (!Objects.equals(WorkflowGraphJson.canonicalize(before.config()), WorkflowGraphJson.canonicalize(after.config()))) {
            fields.add("config");
        }
        if (!Objects.equals(before.position(), after.position())) {
            fields.add("position");
        }
        return fields;
    }

    static List<String> changedFields(WorkflowEdge before, WorkflowEdge after) {
        List<String> fields = new ArrayList<>();
        if (!Objects.equals(before.source(), after.source())) {
            fields.add("source");
        }
        if (!Objects.equals(before.target(), after.target())) {
            fields.add("target");
        }
        if (!Objects.equals(before.sourceHandle(), after.sourceHandle())) {
            fields.add("sourceHandle");
        }
        if (!Objects.equals(before.targetHandle(), after.targetHandle())) {
            fields.add("targetHandle");
        }
        return fields;
    }

    // First occurrence wins for duplicate ids; elements without an id cannot be matched and are skipped.
    private static <T> Map<String, T> byId(List<T> items, Function<T, String> id) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T item : items) {
            String key = id.apply(item);
            if (key != null) {
                map.putIfAbsent(key, item);
            }
        }
        return map;
    }

    private static <T> List<T> missingFrom(Map<String, T> source, Map<String, T> other) {
        return source.entrySet().stream()
                .filter(e -> !other.containsKey(e.getKey()))
                .map(Map.Entry::getValue)
                .toList();
    }
}
