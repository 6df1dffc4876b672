package com.example.workflowguard.audit;

public record GenerationMetrics(
        long totalGenerations,
        long successfulGenerations,
        long failedGenerations,
        double averageGenerationTimeMs,
        long validationFailures,
        long securityIssues,
        long autoCorrections
) {
}
