package com.example.workflowguard.audit;

public enum Outcome {
    SUCCESS,
    FAILURE,
    PARTIAL
}
