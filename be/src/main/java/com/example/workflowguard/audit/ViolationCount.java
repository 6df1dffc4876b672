package com.example.workflowguard.audit;

public record ViolationCount(String type, long count) {
}
