package com.example.workflowguard.validation;

public enum Severity {
    ERROR,
    WARNING
}
