package com.example.workflowguard.versioning;

/**
 * SHA-256 hex fingerprints of the canonical JSON of a version's nodes, edges and both together.
 * Used for deduplication and quick comparison only; they are not an integrity guarantee.
 */
public record VersionChecksums(String nodes, String edges, String full) {
}
