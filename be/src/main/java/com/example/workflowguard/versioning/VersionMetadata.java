package com.example.workflowguard.versioning;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * @param parentVersionId version this one was derived from; null only for the first version of a workflow
 */
@Builder
public record VersionMetadata(
        String createdBy,
        Instant createdAt,
        String description,
        String generationPrompt,
        String parentVersionId,
        List<String> tags
) {
    public VersionMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
