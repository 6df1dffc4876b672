package com.example.workflowguard.validation;

import com.example.workflowguard.graph.BlockType;
import com.example.workflowguard.graph.NodeType;
import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.graph.WorkflowNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks required fields and value domains of every node and edge.
 * <p>
 * Blank node ids and incomplete positions get their own healable codes ({@code MISSING_ID},
 * {@code MISSING_POSITION}); every other violation is reported as {@code SCHEMA_VALIDATION_ERROR}.
 * </p>
 */
public final class SchemaValidator {

    private static final String BLOCK_TYPES = Arrays.toString(BlockType.values());
    private static final String NODE_TYPES = Arrays.toString(NodeType.values());

    private SchemaValidator() {
    }

    public static List<ValidationError> validate(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        Set<String> seenNodeIds = new HashSet<>();
        List<WorkflowNode> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            validateNode(nodes.get(i), i, seenNodeIds, errors);
        }
        Set<String> seenEdgeIds = new HashSet<>();
        List<WorkflowEdge> edges = graph.edges();
        for (int i = 0; i < edges.size(); i++) {
            validateEdge(edges.get(i), i, seenEdgeIds, errors);
        }
        return errors;
    }

    private static void validateNode(WorkflowNode node, int index, Set<String> seenIds, List<ValidationError> errors) {
        boolean hasId = !isBlank(node.id());
        String prefix = "nodes[" + (hasId ? node.id() : index) + "]";
        String nodeId = hasId ? node.id() : null;

        if (!hasId) {
            errors.add(error(ValidationCodes.MISSING_ID, prefix + ".id", "node id is required", nodeId));
        } else if (!seenIds.add(node.id())) {
            errors.add(schemaError(prefix + ".id", "duplicate node id '" + node.id() + "'", nodeId));
        }

        if (isBlank(node.blockType())) {
            errors.add(schemaError(prefix + ".blockType", "blockType is required", nodeId));
        } else if (node.blockTypeValue().isEmpty()) {
            errors.add(schemaError(prefix + ".blockType",
                    "invalid blockType '" + node.blockType() + "'; must be one of: " + BLOCK_TYPES, nodeId));
        }

        if (isBlank(node.nodeType())) {
            errors.add(schemaError(prefix + ".nodeType", "nodeType is required", nodeId));
        } else if (node.nodeTypeValue().isEmpty()) {
            errors.add(schemaError(prefix + ".nodeType",
                    "invalid nodeType '" + node.nodeType() + "'; must be one of: " + NODE_TYPES, nodeId));
        }

        if (node.label() == null) {
            errors.add(schemaError(prefix + ".label", "label is required", nodeId));
        }

        if (node.position() == null || !node.position().isComplete()) {
            errors.add(error(ValidationCodes.MISSING_POSITION, prefix + ".position",
                    "position with numeric x and y is required", nodeId));
        }
    }

    private static void validateEdge(WorkflowEdge edge, int index, Set<String> seenIds, List<ValidationError> errors) {
        boolean hasId = !isBlank(edge.id());
        String prefix = "edges[" + (hasId ? edge.id() : index) + "]";

        if (!hasId) {
            errors.add(edgeError(prefix + ".id", "edge id is required", null));
        } else if (!seenIds.add(edge.id())) {
            errors.add(edgeError(prefix + ".id", "duplicate edge id '" + edge.id() + "'", edge.id()));
        }
        if (isBlank(edge.source())) {
            errors.add(edgeError(prefix + ".source", "edge source is required", edge.id()));
        }
        if (isBlank(edge.target())) {
            errors.add(edgeError(prefix + ".target", "edge target is required", edge.id()));
        }
    }

    private static ValidationError schemaError(String field, String message, String nodeId) {
        return error(ValidationCodes.SCHEMA_VALIDATION_ERROR, field, message, nodeId);
    }

    private static ValidationError error(String code, String field, String message, String nodeId) {
        return ValidationError.builder()
                .kind(ErrorKind.SCHEMA)
                .code(code)
                .field(field)
                .message(field + ": " + message)
                .nodeId(nodeId)
                .severity(Severity.ERROR)
                .build();
    }

    private static ValidationError edgeError(String field, String message, String edgeId) {
        return ValidationError.builder()
                .kind(ErrorKind.SCHEMA)
                .code(ValidationCodes.SCHEMA_VALIDATION_ERROR)
                .field(field)
                .message(field + ": " + message)
                .edgeId(edgeId)
                .severity(Severity.ERROR)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
