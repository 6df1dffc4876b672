package com.example.workflowguard.versioning;

/**
 * Paging and filtering for {@link VersionStore#getVersionHistory(String, HistoryQuery)}.
 */
public record HistoryQuery(boolean includeArchived, int limit, int offset) {

    public static final HistoryQuery DEFAULTS = new HistoryQuery(false, 50, 0);

    public HistoryQuery {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
    }
}
