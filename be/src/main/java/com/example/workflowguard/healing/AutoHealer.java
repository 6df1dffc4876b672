package com.example.workflowguard.healing;

import com.example.workflowguard.graph.BlockConfig;
import com.example.workflowguard.graph.Position;
import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;
import com.example.workflowguard.validation.GraphAnalyzer;
import com.example.workflowguard.validation.ValidationCodes;
import com.example.workflowguard.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Deterministic repair of a fixed set of findings.
 * <p>
 * One call is one pass: the input graph is never modified, nothing is deleted, and the healer does not re-validate
 * its own output. Callers that want convergence re-run validation on the corrected graph (see
 * {@code ValidationPipeline#validateUntilStable}).
 * </p>
 */
@Slf4j
public class AutoHealer {

    public static final Set<String> HEALABLE_CODES = Set.of(
            ValidationCodes.MISSING_ID,
            ValidationCodes.MISSING_POSITION,
            ValidationCodes.MISSING_REQUIRED_CONFIG,
            ValidationCodes.UNREACHABLE_NODES);

    public static final int DEFAULT_MAX_AUTO_CONNECTIONS = 3;

    private static final int GRID_COLUMNS = 4;
    private static final double GRID_ORIGIN = 100;
    private static final double GRID_COLUMN_WIDTH = 250;
    private static final double GRID_ROW_HEIGHT = 150;

    private final int maxAutoConnections;
    private final Supplier<String> idGenerator;

    public AutoHealer(int maxAutoConnections, Supplier<String> idGenerator) {
        if (maxAutoConnections < 0) {
            throw new IllegalArgumentException("maxAutoConnections must not be negative");
        }
        this.maxAutoConnections = maxAutoConnections;
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public static AutoHealer withDefaults() {
        return new AutoHealer(DEFAULT_MAX_AUTO_CONNECTIONS, () -> UUID.randomUUID().toString());
    }

    public static boolean isHealable(ValidationError error) {
        return error != null && HEALABLE_CODES.contains(error.code());
    }

    /**
     * Applies every applicable repair for the given findings.
     *
     * @return the corrected graph, or empty when no repair changed anything
     */
    public Optional<WorkflowGraph> heal(WorkflowGraph graph, List<ValidationError> errors) {
        Objects.requireNonNull(graph, "graph");
        Set<String> codes = errors == null ? Set.of() : errors.stream()
                .map(ValidationError::code)
                .filter(HEALABLE_CODES::contains)
                .collect(Collectors.toSet());
        if (codes.isEmpty()) {
            return Optional.empty();
        }

        HealingReport report = new HealingReport();
        WorkflowGraph healed = graph;
        if (codes.contains(ValidationCodes.MISSING_ID)) {
            healed = assignMissingIds(healed, report);
        }
        if (codes.contains(ValidationCodes.MISSING_POSITION)) {
            healed = assignMissingPositions(healed, report);
        }
        if (codes.contains(ValidationCodes.MISSING_REQUIRED_CONFIG)) {
            healed = completeRequiredConfig(healed, configTargets(errors), report);
        }
        if (codes.contains(ValidationCodes.UNREACHABLE_NODES)) {
            healed = connectUnreachable(healed, report);
        }

        if (healed.equals(graph)) {
            log.debug("Auto-heal found nothing to change for codes={}", codes);
            return Optional.empty();
        }
        log.info("Auto-heal applied: idsAssigned={} positionsAssigned={} configsCompleted={} edgesAdded={}",
                report.idsAssigned, report.positionsAssigned, report.configsCompleted, report.edgesAdded);
        return Optional.of(healed);
    }

    private WorkflowGraph assignMissingIds(WorkflowGraph graph, HealingReport report) {
        Set<String> used = new HashSet<>(graph.nodeIds());
        List<WorkflowNode> nodes = new ArrayList<>(graph.nodes().size());
        for (WorkflowNode node : graph.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                String id;
                do {
                    id = "node-" + idGenerator.get();
                } while (!used.add(id));
                nodes.add(node.withId(id));
                report.idsAssigned++;
            } else {
                nodes.add(node);
            }
        }
        return graph.withNodes(nodes);
    }

    private WorkflowGraph assignMissingPositions(WorkflowGraph graph, HealingReport report) {
        List<WorkflowNode> nodes = new ArrayList<>(graph.nodes().size());
        for (int i = 0; i < graph.nodes().size(); i++) {
            WorkflowNode node = graph.nodes().get(i);
            if (node.position() == null || !node.position().isComplete()) {
                nodes.add(node.withPosition(Position.of(
                        GRID_ORIGIN + GRID_COLUMN_WIDTH * (i % GRID_COLUMNS),
                        GRID_ORIGIN + GRID_ROW_HEIGHT * (i / GRID_COLUMNS))));
                report.positionsAssigned++;
            } else {
                nodes.add(node);
            }
        }
        return graph.withNodes(nodes);
    }

    private static Set<String> configTargets(List<ValidationError> errors) {
        return errors.stream()
                .filter(e -> ValidationCodes.MISSING_REQUIRED_CONFIG.equals(e.code()))
                .map(ValidationError::nodeId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private WorkflowGraph completeRequiredConfig(WorkflowGraph graph, Set<String> targets, HealingReport report) {
        List<WorkflowNode> nodes = new ArrayList<>(graph.nodes().size());
        for (WorkflowNode node : graph.nodes()) {
            if (!targets.contains(node.id()) || node.blockTypeValue().isEmpty()) {
                nodes.add(node);
                continue;
            }
            Map<String, Object> merged = new LinkedHashMap<>(node.config());
            boolean changed = false;
            for (Map.Entry<String, Object> entry : BlockConfig.defaultsFor(node.blockTypeValue().get()).entrySet()) {
                Object current = merged.get(entry.getKey());
                if (current == null || String.valueOf(current).isBlank()) {
                    merged.put(entry.getKey(), entry.getValue());
                    changed = true;
                }
            }
            if (changed) {
                nodes.add(node.withConfig(merged));
                report.configsCompleted++;
            } else {
                nodes.add(node);
            }
        }
        return graph.withNodes(nodes);
    }

    /**
     * Wires unreachable nodes as targets of the first trigger. Nodes without incoming edges go first, since
     * connecting the head of a detached chain makes the rest of the chain reachable too. Nodes that can reach the
     * trigger are skipped so the new edge cannot close a cycle.
     */
    private WorkflowGraph connectUnreachable(WorkflowGraph graph, HealingReport report) {
        Optional<WorkflowNode> trigger = graph.triggerNodes().stream()
                .filter(t -> t.id() != null && !t.id().isBlank())
                .findFirst();
        if (trigger.isEmpty() || maxAutoConnections == 0) {
            return graph;
        }
        String triggerId = trigger.get().id();
        Set<String> targeted = GraphAnalyzer.targetedNodeIds(graph);
        Set<String> reachesTrigger = ancestorsOf(graph, triggerId);

        List<WorkflowNode> candidates = GraphAnalyzer.findUnreachable(graph).stream()
                .filter(node -> node.id() != null && !node.id().isBlank())
                .filter(node -> !node.isTrigger())
                .filter(node -> !reachesTrigger.contains(node.id()))
                .sorted(Comparator.comparing(node -> targeted.contains(node.id())))
                .toList();

        List<WorkflowEdge> added = new ArrayList<>();
        Set<String> connected = new HashSet<>();
        for (WorkflowNode candidate : candidates) {
            if (added.size() >= maxAutoConnections) {
                break;
            }
            if (connected.add(candidate.id())) {
                added.add(WorkflowEdge.of("edge-" + idGenerator.get(), triggerId, candidate.id()));
            }
        }
        if (added.isEmpty()) {
            return graph;
        }
        report.edgesAdded += added.size();
        return graph.withAddedEdges(added);
    }

    private static Set<String> ancestorsOf(WorkflowGraph graph, String nodeId) {
        Map<String, List<String>> incoming = new HashMap<>();
        for (WorkflowEdge edge : graph.edges()) {
            if (edge.source() != null && edge.target() != null) {
                incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
            }
        }
        Set<String> ancestors = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            for (String source : incoming.getOrDefault(queue.poll(), List.of())) {
                if (ancestors.add(source)) {
                    queue.add(source);
                }
            }
        }
        return ancestors;
    }

    private static final class HealingReport {
        private int idsAssigned;
        private int positionsAssigned;
        private int configsCompleted;
        private int edgesAdded;
    }
}
