package com.example.workflowguard.generation;

import com.example.workflowguard.graph.WorkflowGraph;

/**
 * Produces a candidate workflow graph from a natural-language description, typically through a language model.
 * The returned graph is untrusted and is always validated before use.
 */
@FunctionalInterface
public interface GenerationProvider {

    /**
     * @param description sanitized user description
     * @throws RuntimeException when generation fails; the failure is audited and rethrown to the caller
     */
    WorkflowGraph generate(String description);
}
