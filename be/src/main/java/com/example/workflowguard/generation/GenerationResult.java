package com.example.workflowguard.generation;

import com.example.workflowguard.graph.WorkflowGraph;
import com.example.workflowguard.security.PromptScanResult;
import com.example.workflowguard.validation.ValidationResult;
import com.example.workflowguard.versioning.WorkflowVersion;

import java.util.Optional;

/**
 * @param graph   the accepted graph: the healed graph when healing made it valid, otherwise the raw candidate
 * @param version the snapshot created for this run, or null
 */
public record GenerationResult(
        WorkflowGraph graph,
        ValidationResult validation,
        PromptScanResult promptScan,
        WorkflowVersion version,
        boolean autoCorrected,
        long durationMs
) {
    public Optional<WorkflowVersion> createdVersion() {
        return Optional.ofNullable(version);
    }
}
