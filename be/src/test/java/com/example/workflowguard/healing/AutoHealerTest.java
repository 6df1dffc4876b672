package com.example.workflowguard.healing;

import com.example.workflowguard.graph.BlockType;
import com.example.workflowguard.graph.NodeType;
import com.example.workflowguard.graph.Position;
import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;
import com.example.workflowguard.validation.ErrorKind;
import com.example.workflowguard.validation.GraphAnalyzer;
import com.example.workflowguard.validation.ValidationCodes;
import com.example.workflowguard.validation.ValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.workflowguard.graph.TestGraphs.action;
import static com.example.workflowguard.graph.TestGraphs.edge;
import static com.example.workflowguard.graph.TestGraphs.graph;
import static com.example.workflowguard.graph.TestGraphs.node;
import static com.example.workflowguard.graph.TestGraphs.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AutoHealer")
class AutoHealerTest {

    private AutoHealer healer;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        healer = new AutoHealer(3, () -> String.valueOf(ids.incrementAndGet()));
    }

    private static ValidationError finding(String code) {
        return ValidationError.builder().kind(ErrorKind.GRAPH).code(code).message(code).build();
    }

    private static ValidationError missingConfig(String nodeId) {
        return ValidationError.builder()
                .kind(ErrorKind.BUSINESS)
                .code(ValidationCodes.MISSING_REQUIRED_CONFIG)
                .message("missing config")
                .nodeId(nodeId)
                .build();
    }

    @Test
    @DisplayName("returns nothing when no finding is healable")
    void nothingHealable() {
        WorkflowGraph graph = graph(List.of(action("A")));

        assertThat(healer.heal(graph, List.of(finding(ValidationCodes.NO_TRIGGER_NODE),
                finding(ValidationCodes.CYCLE_DETECTED)))).isEmpty();
        assertThat(healer.heal(graph, List.of())).isEmpty();
    }

    @Test
    @DisplayName("classifies exactly the four repairable codes as healable")
    void healableCodes() {
        assertThat(AutoHealer.HEALABLE_CODES).containsExactlyInAnyOrder(ValidationCodes.MISSING_ID,
                ValidationCodes.MISSING_POSITION, ValidationCodes.MISSING_REQUIRED_CONFIG,
                ValidationCodes.UNREACHABLE_NODES);
        assertTrue(AutoHealer.isHealable(finding(ValidationCodes.UNREACHABLE_NODES)));
        assertThat(AutoHealer.isHealable(finding(ValidationCodes.SCHEMA_VALIDATION_ERROR))).isFalse();
    }

    @Nested
    @DisplayName("node repairs")
    class NodeRepairs {

        @Test
        @DisplayName("assigns fresh ids to nodes without one")
        void missingIds() {
            WorkflowGraph graph = graph(List.of(trigger("T"), action(null), action(" ")));

            WorkflowGraph healed = healer.heal(graph, List.of(finding(ValidationCodes.MISSING_ID))).orElseThrow();

            assertThat(healed.nodes()).extracting(WorkflowNode::id).containsExactly("T", "node-1", "node-2");
        }

        @Test
        @DisplayName("generated ids skip ids already in the graph")
        void idCollision() {
            WorkflowGraph graph = graph(List.of(trigger("node-1"), action(null)));

            WorkflowGraph healed = healer.heal(graph, List.of(finding(ValidationCodes.MISSING_ID))).orElseThrow();

            assertThat(healed.nodes()).extracting(WorkflowNode::id).containsExactly("node-1", "node-2");
        }

        @Test
        @DisplayName("lays out nodes without a position on a four-column grid")
        void missingPositions() {
            List<WorkflowNode> nodes = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                nodes.add(action("n" + i));
            }
            nodes.set(5, nodes.get(5).withPosition(null));

            WorkflowGraph healed = healer.heal(graph(nodes), List.of(finding(ValidationCodes.MISSING_POSITION)))
                    .orElseThrow();

            assertEquals(Position.of(350, 250), healed.nodes().get(5).position());
            assertEquals(nodes.get(0).position(), healed.nodes().get(0).position());
        }

        @Test
        @DisplayName("adds default configuration without overwriting present values")
        void completesMissingConfig() {
            WorkflowNode http = node("H", BlockType.HTTP_REQUEST, NodeType.ACTION, Map.of("url", "https://api.example.org"));

            WorkflowGraph healed = healer.heal(graph(List.of(trigger("T"), http)), List.of(missingConfig("H")))
                    .orElseThrow();

            assertThat(healed.findNode("H").orElseThrow().config())
                    .containsEntry("url", "https://api.example.org")
                    .containsEntry("method", "GET");
        }

        @Test
        @DisplayName("only completes the nodes named by the findings")
        void missingConfigTargetsOnly() {
            WorkflowNode named = node("H1", BlockType.NOTIFICATION, NodeType.ACTION, Map.of());
            WorkflowNode other = node("H2", BlockType.NOTIFICATION, NodeType.ACTION, Map.of());

            WorkflowGraph healed = healer.heal(graph(List.of(trigger("T"), named, other)), List.of(missingConfig("H1")))
                    .orElseThrow();

            assertThat(healed.findNode("H1").orElseThrow().config()).containsKey("message");
            assertThat(healed.findNode("H2").orElseThrow().config()).isEmpty();
        }
    }

    @Nested
    @DisplayName("reachability repair")
    class Reachability {

        @Test
        @DisplayName("connects at most three unreachable nodes to the first trigger")
        void capsConnections() {
            WorkflowGraph graph = graph(List.of(trigger("T"), trigger("T2"), action("A"), action("B"),
                    action("C"), action("D")));

            WorkflowGraph healed = healer.heal(graph, List.of(finding(ValidationCodes.UNREACHABLE_NODES)))
                    .orElseThrow();

            assertThat(healed.edges()).hasSize(3)
                    .allSatisfy(e -> assertThat(e.source()).isEqualTo("T"))
                    .extracting(WorkflowEdge::target).containsExactly("A", "B", "C");
            assertThat(healed.edges()).extracting(WorkflowEdge::id).containsExactly("edge-1", "edge-2", "edge-3");
        }

        @Test
        @DisplayName("prefers heads of detached chains")
        void prefersChainHeads() {
            AutoHealer twoEdges = new AutoHealer(2, () -> "x");
            WorkflowGraph graph = graph(List.of(trigger("T"), action("C"), action("B"), action("D")),
                    edge("B", "C"));

            WorkflowGraph healed = twoEdges.heal(graph, List.of(finding(ValidationCodes.UNREACHABLE_NODES)))
                    .orElseThrow();

            assertThat(healed.edges()).extracting(WorkflowEdge::target).containsExactly("C", "B", "D");
            assertThat(GraphAnalyzer.findUnreachable(healed)).isEmpty();
        }

        @Test
        @DisplayName("skips nodes that lead back to the trigger")
        void avoidsCycles() {
            WorkflowGraph graph = graph(List.of(trigger("T"), action("A")), edge("A", "T"));

            Optional<WorkflowGraph> healed = healer.heal(graph, List.of(finding(ValidationCodes.UNREACHABLE_NODES)));

            assertThat(healed).isEmpty();
        }

        @Test
        @DisplayName("does nothing without a trigger")
        void noTrigger() {
            assertThat(healer.heal(graph(List.of(action("A"))), List.of(finding(ValidationCodes.UNREACHABLE_NODES))))
                    .isEmpty();
        }
    }

    @Test
    @DisplayName("never modifies or shrinks the input graph")
    void inputUntouched() {
        WorkflowGraph graph = graph(List.of(trigger("T"), action(null).withPosition(null), action("A")), edge("T", "A"));
        WorkflowGraph snapshot = new WorkflowGraph(new ArrayList<>(graph.nodes()), new ArrayList<>(graph.edges()));

        WorkflowGraph healed = healer.heal(graph, List.of(finding(ValidationCodes.MISSING_ID),
                finding(ValidationCodes.MISSING_POSITION), finding(ValidationCodes.UNREACHABLE_NODES))).orElseThrow();

        assertEquals(snapshot, graph);
        assertThat(healed.nodes()).hasSize(graph.nodes().size());
        assertThat(healed.edges()).containsAll(graph.edges());
        assertThat(healed.edges()).hasSize(graph.edges().size() + 1);
        assertThat(healed.nodes()).noneMatch(n -> n.id() == null);
        assertThat(healed.nodes()).allMatch(n -> n.position().isComplete());
    }
}
