package com.example.workflowguard.versioning;

/**
 * @param maxVersions              stored versions above which retention archives older ones
 * @param retainRecent             non-active versions kept unarchived by retention
 * @param rollbackWarningDistance  rolling back more versions than this yields a compatibility warning
 */
public record VersionRetention(int maxVersions, int retainRecent, int rollbackWarningDistance) {

    public static final VersionRetention DEFAULTS = new VersionRetention(50, 20, 5);

    public VersionRetention {
        if (maxVersions < 1 || retainRecent < 0 || rollbackWarningDistance < 0) {
            throw new IllegalArgumentException("Invalid version retention settings");
        }
    }
}
