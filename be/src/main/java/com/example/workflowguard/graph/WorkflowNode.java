package com.example.workflowguard.graph;

import java.util.Map;
import java.util.Optional;

/**
 * One block of a workflow graph as received from the generator or editor.
 * <p>
 * {@code blockType} and {@code nodeType} are kept as raw text: the schema validator decides whether they are
 * recognized values. Use {@link #blockTypeValue()}, {@link #nodeTypeValue()} and {@link #typedConfig()} for
 * checked access.
 * </p>
 */
public record WorkflowNode(
        String id,
        String blockType,
        String nodeType,
        String label,
        String description,
        Map<String, Object> config,
        Position position,
        Boolean enabled
) {
    public WorkflowNode {
        config = WorkflowGraphJson.immutableMapCopy(config);
    }

    public static WorkflowNode of(String id, BlockType blockType, NodeType nodeType, String label,
                                  Map<String, Object> config, Position position) {
        return new WorkflowNode(id, blockType.name(), nodeType.name(), label, null, config, position, true);
    }

    public Optional<BlockType> blockTypeValue() {
        return BlockType.fromValue(blockType);
    }

    public Optional<NodeType> nodeTypeValue() {
        return NodeType.fromValue(nodeType);
    }

    public boolean isTrigger() {
        return nodeTypeValue().filter(NodeType.TRIGGER::equals).isPresent();
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public BlockConfig typedConfig() {
        return BlockConfig.of(blockTypeValue().orElse(BlockType.UNKNOWN), config);
    }

    /** Label for messages; falls back to the id when the label is blank. */
    public String displayName() {
        return label != null && !label.isBlank() ? label : String.valueOf(id);
    }

    public WorkflowNode withId(String newId) {
        return new WorkflowNode(newId, blockType, nodeType, label, description, config, position, enabled);
    }

    public WorkflowNode withConfig(Map<String, Object> newConfig) {
        return new WorkflowNode(id, blockType, nodeType, label, description, newConfig, position, enabled);
    }

    public WorkflowNode withPosition(Position newPosition) {
        return new WorkflowNode(id, blockType, nodeType, label, description, config, newPosition, enabled);
    }
}
