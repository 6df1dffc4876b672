package com.example.workflowguard.versioning;

import com.example.workflowguard.graph.WorkflowEdge;
import com.example.workflowguard.graph.WorkflowGraphJson;
import com.example.workflowguard.graph.WorkflowNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link VersionChecksums} over the canonical JSON form of nodes and edges, so that equal content
 * always yields equal fingerprints regardless of map ordering.
 */
public class ContentChecksums {

    private final WorkflowGraphJson graphJson;

    public ContentChecksums(WorkflowGraphJson graphJson) {
        this.graphJson = Objects.requireNonNull(graphJson, "graphJson");
    }

    public VersionChecksums compute(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        List<Map<String, Object>> nodeMaps = nodes.stream().map(WorkflowGraphJson::nodeToMap).toList();
        List<Map<String, Object>> edgeMaps = edges.stream().map(WorkflowGraphJson::edgeToMap).toList();
        Map<String, Object> full = new LinkedHashMap<>();
        full.put("nodes", nodeMaps);
        full.put("edges", edgeMaps);
        return new VersionChecksums(
                sha256Hex(graphJson.writeCanonical(nodeMaps)),
                sha256Hex(graphJson.writeCanonical(edgeMaps)),
                sha256Hex(graphJson.writeCanonical(full)));
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
