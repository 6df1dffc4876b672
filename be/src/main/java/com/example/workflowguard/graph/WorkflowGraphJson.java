package com.example.workflowguard.graph;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reads untrusted graph JSON into the graph model and writes graphs back as canonical JSON.
 * <p>
 * Accepts both the editor shape (block fields nested under {@code data}) and the flat shape. Values of the wrong
 * JSON type are dropped rather than coerced, so the schema validator sees them as missing.
 * </p>
 */
public class WorkflowGraphJson {

    private final JsonMapper jsonMapper;

    public WorkflowGraphJson(JsonMapper jsonMapper) {
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public WorkflowGraph read(String json) {
        Map<String, Object> root;
        try {
            root = jsonMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JacksonException e) {
            throw new IllegalArgumentException("Workflow graph is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            return WorkflowGraph.empty();
        }
        List<WorkflowNode> nodes = new ArrayList<>();
        for (Object item : list(root.get("nodes"))) {
            if (item instanceof Map<?, ?> map) {
                nodes.add(readNode(map));
            }
        }
        List<WorkflowEdge> edges = new ArrayList<>();
        for (Object item : list(root.get("edges"))) {
            if (item instanceof Map<?, ?> map) {
                edges.add(new WorkflowEdge(
                        string(map.get("id")),
                        string(map.get("source")),
                        string(map.get("target")),
                        string(map.get("sourceHandle")),
                        string(map.get("targetHandle"))));
            }
        }
        return new WorkflowGraph(nodes, edges);
    }

    /** Canonical JSON (sorted keys, nulls omitted) of the whole graph. */
    public String write(WorkflowGraph graph) {
        return writeCanonical(toMap(graph));
    }

    /** Canonical JSON of any map/list/scalar structure. */
    public String writeCanonical(Object value) {
        try {
            return jsonMapper.writeValueAsString(canonicalize(value));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow graph", e);
        }
    }

    public static Map<String, Object> toMap(WorkflowGraph graph) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("nodes", graph.nodes().stream().map(WorkflowGraphJson::nodeToMap).toList());
        map.put("edges", graph.edges().stream().map(WorkflowGraphJson::edgeToMap).toList());
        return map;
    }

    public static Map<String, Object> nodeToMap(WorkflowNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "id", node.id());
        putIfPresent(map, "blockType", node.blockType());
        putIfPresent(map, "nodeType", node.nodeType());
        putIfPresent(map, "label", node.label());
        putIfPresent(map, "description", node.description());
        map.put("config", node.config());
        if (node.position() != null) {
            Map<String, Object> position = new LinkedHashMap<>();
            putIfPresent(position, "x", node.position().x());
            putIfPresent(position, "y", node.position().y());
            map.put("position", position);
        }
        map.put("isEnabled", node.isEnabled());
        return map;
    }

    public static Map<String, Object> edgeToMap(WorkflowEdge edge) {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "id", edge.id());
        putIfPresent(map, "source", edge.source());
        putIfPresent(map, "target", edge.target());
        putIfPresent(map, "sourceHandle", edge.sourceHandle());
        putIfPresent(map, "targetHandle", edge.targetHandle());
        return map;
    }

    /** Recursively sorts map keys and drops null map values so equal content always serializes identically. */
    public static Object canonicalize(Object source) {
        if (source instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (source instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(canonicalize(item));
            }
            return normalized;
        }
        return source;
    }

    /**
     * Recursively copies maps and lists into unmodifiable structures, keeping entry order and null values.
     * Leaves other values as they are.
     */
    public static Object immutableCopy(Object source) {
        if (source instanceof Map<?, ?> map) {
            return immutableMapCopy(map);
        }
        if (source instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(immutableCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return source;
    }

    public static Map<String, Object> immutableMapCopy(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), immutableCopy(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static WorkflowNode readNode(Map<?, ?> raw) {
        Map<?, ?> data = raw.get("data") instanceof Map<?, ?> nested ? nested : raw;
        Map<String, Object> config = new LinkedHashMap<>();
        if (data.get("config") instanceof Map<?, ?> rawConfig) {
            rawConfig.forEach((k, v) -> config.put(String.valueOf(k), v));
        }
        Position position = null;
        if (raw.get("position") instanceof Map<?, ?> rawPosition) {
            position = new Position(number(rawPosition.get("x")), number(rawPosition.get("y")));
        }
        Boolean enabled = data.get("isEnabled") instanceof Boolean flag ? flag : null;
        return new WorkflowNode(
                string(raw.get("id")),
                string(data.get("blockType")),
                string(data.get("nodeType")),
                string(data.get("label")),
                string(data.get("description")),
                config,
                position,
                enabled);
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> items ? items : List.of();
    }

    private static String string(Object value) {
        return value instanceof String text ? text : null;
    }

    private static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
