package com.example.workflowguard.validation;

/**
 * Which validation stage produced a finding.
 */
public enum ErrorKind {
    SCHEMA,
    BUSINESS,
    GRAPH,
    SECURITY
}
