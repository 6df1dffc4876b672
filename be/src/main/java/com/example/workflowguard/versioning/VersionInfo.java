package com.example.workflowguard.versioning;

import lombok.Builder;

import java.util.List;

/**
 * Caller-supplied details for a new version. Every field is optional: the store fills in a name, the creator
 * {@code system} and the latest version as parent.
 */
@Builder
public record VersionInfo(
        String name,
        String description,
        String createdBy,
        String generationPrompt,
        String parentVersionId,
        List<String> tags
) {
    public static final VersionInfo EMPTY = VersionInfo.builder().build();

    public VersionInfo {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
