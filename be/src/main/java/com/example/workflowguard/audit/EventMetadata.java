package com.example.workflowguard.audit;

/**
 * @param automated     the event was produced without a direct user request (generation, scanning)
 * @param userInitiated the event records something a user explicitly asked for
 */
public record EventMetadata(String source, String appVersion, boolean automated, boolean userInitiated) {
}
