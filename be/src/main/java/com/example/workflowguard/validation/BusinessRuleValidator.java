package com.example.workflowguard.validation;

import com.example.workflowguard.graph.NodeType;
import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Domain rules: trigger presence, required configuration per block type and node-type adjacency.
 */
public final class BusinessRuleValidator {

    static final int MAX_TRIGGERS_BEFORE_WARNING = 3;

    private BusinessRuleValidator() {
    }

    public static ValidationFindings validate(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        int triggers = graph.triggerNodes().size();
        if (triggers == 0) {
            errors.add(ValidationError.builder()
                    .kind(ErrorKind.BUSINESS)
                    .code(ValidationCodes.NO_TRIGGER_NODE)
                    .message("Workflow must have at least one trigger node")
                    .severity(Severity.ERROR)
                    .build());
        } else if (triggers > MAX_TRIGGERS_BEFORE_WARNING) {
            warnings.add(new ValidationWarning(ErrorKind.BUSINESS, ValidationCodes.TOO_MANY_TRIGGERS,
                    "Multiple trigger nodes (" + triggers + ") may lead to complex execution patterns",
                    "Consider consolidating triggers or using logic nodes"));
        }

        for (WorkflowNode node : graph.nodes()) {
            if (node.blockTypeValue().isEmpty()) {
                continue;
            }
            List<String> missing = node.typedConfig().missingRequiredFields();
            if (!missing.isEmpty()) {
                errors.add(ValidationError.builder()
                        .kind(ErrorKind.BUSINESS)
                        .code(ValidationCodes.MISSING_REQUIRED_CONFIG)
                        .field("nodes[" + node.id() + "].config")
                        .message("Node " + node.displayName() + " is missing required configuration: "
                                + String.join(", ", missing))
                        .nodeId(node.id())
                        .missingFields(missing)
                        .severity(Severity.ERROR)
                        .build());
            }
        }

        Map<String, WorkflowNode> byId = graph.nodes().stream()
                .filter(n -> n.id() != null)
                .collect(Collectors.toMap(WorkflowNode::id, Function.identity(), (first, second) -> first));
        for (WorkflowEdge edge : graph.edges()) {
            WorkflowNode source = byId.get(edge.source());
            WorkflowNode target = byId.get(edge.target());
            if (source != null && target != null && actionFeedsTrigger(source, target)) {
                warnings.add(new ValidationWarning(ErrorKind.BUSINESS, ValidationCodes.INCOMPATIBLE_CONNECTION,
                        "Potential compatibility issue between " + source.displayName() + " and " + target.displayName(),
                        "Actions should not connect directly to triggers", target.id()));
            }
        }
        return new ValidationFindings(errors, warnings);
    }

    // Heuristic only: feedback loops into a trigger can be legitimate.
    private static boolean actionFeedsTrigger(WorkflowNode source, WorkflowNode target) {
        Optional<NodeType> from = source.nodeTypeValue();
        return from.isPresent() && from.get() == NodeType.ACTION && target.isTrigger();
    }
}
