package com.example.workflowguard.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Execution role of a node in the graph.
 */
public enum NodeType {
    TRIGGER,
    ACTION,
    LOGIC;

    public static Optional<NodeType> fromValue(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
