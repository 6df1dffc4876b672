package com.example.workflowguard.generation;

import com.example.workflowguard.validation.ValidationOptions;
import lombok.Builder;

/**
 * @param workflowId      workflow to snapshot the accepted graph into; no version is created when null
 * @param createVersion   snapshot the graph when it validates
 * @param versionName     optional name of the created version
 */
@Builder
public record GenerationRequest(
        String description,
        String userId,
        String sessionId,
        String workflowId,
        boolean createVersion,
        String versionName,
        ValidationOptions options
) {
}
