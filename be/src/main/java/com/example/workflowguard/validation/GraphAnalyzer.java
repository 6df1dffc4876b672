package com.example.workflowguard.validation;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural analysis of the directed graph: cycles, reachability from triggers, orphans and dangling edges.
 * <p>
 * Traversals are iterative so that very deep generated graphs cannot exhaust the call stack. Edges whose
 * endpoints are not node ids of the graph are ignored by the traversals and reported by {@link #validate}.
 * </p>
 */
public final class GraphAnalyzer {

    private GraphAnalyzer() {
    }

    /**
     * Depth-first search with a visited set and a recursion-stack set. Stops at the first back edge.
     */
    public static boolean hasCycle(WorkflowGraph graph) {
        Map<String, List<String>> adjacency = adjacency(graph);
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            visited.add(start);
            onStack.add(start);
            path.push(start);
            pending.push(adjacency.get(start).iterator());

            while (!pending.isEmpty()) {
                Iterator<String> next = pending.peek();
                if (!next.hasNext()) {
                    pending.pop();
                    onStack.remove(path.pop());
                    continue;
                }
                String target = next.next();
                if (onStack.contains(target)) {
                    return true;
                }
                if (visited.add(target)) {
                    onStack.add(target);
                    path.push(target);
                    pending.push(adjacency.get(target).iterator());
                }
            }
        }
        return false;
    }

    /**
     * Nodes not reachable from any TRIGGER node, in graph order. A graph without triggers has every node
     * unreachable.
     */
    public static List<WorkflowNode> findUnreachable(WorkflowGraph graph) {
        List<WorkflowNode> triggers = graph.triggerNodes();
        if (triggers.isEmpty()) {
            return graph.nodes();
        }
        Map<String, List<String>> adjacency = adjacency(graph);
        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (WorkflowNode trigger : triggers) {
            if (trigger.id() != null && reachable.add(trigger.id())) {
                queue.add(trigger.id());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String target : adjacency.getOrDefault(current, List.of())) {
                if (reachable.add(target)) {
                    queue.add(target);
                }
            }
        }
        return graph.nodes().stream()
                .filter(node -> node.id() == null || !reachable.contains(node.id()))
                .toList();
    }

    /**
     * Nodes with no incident edge in either direction.
     */
    public static List<WorkflowNode> findOrphans(WorkflowGraph graph) {
        Set<String> connected = new HashSet<>();
        for (WorkflowEdge edge : graph.edges()) {
            connected.add(edge.source());
            connected.add(edge.target());
        }
        return graph.nodes().stream()
                .filter(node -> node.id() == null || !connected.contains(node.id()))
                .toList();
    }

    /**
     * Edges whose source or target does not name a node of the graph.
     */
    public static List<WorkflowEdge> findDanglingEdges(WorkflowGraph graph) {
        Set<String> ids = graph.nodeIds();
        return graph.edges().stream()
                .filter(edge -> edge.source() != null && edge.target() != null)
                .filter(edge -> !ids.contains(edge.source()) || !ids.contains(edge.target()))
                .toList();
    }

    /**
     * Ids of nodes that are the target of at least one edge.
     */
    public static Set<String> targetedNodeIds(WorkflowGraph graph) {
        return graph.edges().stream()
                .map(WorkflowEdge::target)
                .filter(target -> target != null)
                .collect(Collectors.toSet());
    }

    /**
     * Graph stage of the pipeline.
     */
    public static ValidationFindings validate(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        for (WorkflowEdge edge : findDanglingEdges(graph)) {
            errors.add(ValidationError.builder()
                    .kind(ErrorKind.GRAPH)
                    .code(ValidationCodes.INVALID_EDGE_REFERENCE)
                    .field("edges[" + edge.id() + "]")
                    .message("Edge " + edge.id() + " references a missing node: " + edge.source() + " -> " + edge.target())
                    .edgeId(edge.id())
                    .severity(Severity.ERROR)
                    .build());
        }

        if (hasCycle(graph)) {
            errors.add(ValidationError.builder()
                    .kind(ErrorKind.GRAPH)
                    .code(ValidationCodes.CYCLE_DETECTED)
                    .message("Workflow contains cycles which may cause infinite loops")
                    .severity(Severity.ERROR)
                    .build());
        }

        List<WorkflowNode> unreachable = findUnreachable(graph);
        if (!unreachable.isEmpty()) {
            errors.add(ValidationError.builder()
                    .kind(ErrorKind.GRAPH)
                    .code(ValidationCodes.UNREACHABLE_NODES)
                    .message("Found " + unreachable.size() + " unreachable nodes: " + describe(unreachable))
                    .severity(Severity.WARNING)
                    .build());
        }

        List<WorkflowNode> orphans = findOrphans(graph);
        if (!orphans.isEmpty()) {
            warnings.add(new ValidationWarning(ErrorKind.GRAPH, ValidationCodes.ORPHANED_NODES,
                    "Found " + orphans.size() + " orphaned nodes: " + describe(orphans),
                    "Connect orphaned nodes or remove them"));
        }
        return new ValidationFindings(errors, warnings);
    }

    private static Map<String, List<String>> adjacency(WorkflowGraph graph) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (WorkflowNode node : graph.nodes()) {
            if (node.id() != null) {
                adjacency.putIfAbsent(node.id(), new ArrayList<>());
            }
        }
        for (WorkflowEdge edge : graph.edges()) {
            List<String> targets = adjacency.get(edge.source());
            if (targets != null && adjacency.containsKey(edge.target())) {
                targets.add(edge.target());
            }
        }
        return adjacency;
    }

    private static String describe(List<WorkflowNode> nodes) {
        return nodes.stream()
                .limit(10)
                .map(WorkflowNode::displayName)
                .collect(Collectors.joining(", "))
                + (nodes.size() > 10 ? ", ..." : "");
    }
}
