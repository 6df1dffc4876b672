package com.example.workflowguard.versioning;

public record DiffSummary(int totalChanges, boolean significantChanges) {
}
