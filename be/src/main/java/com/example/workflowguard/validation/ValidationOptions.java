package com.example.workflowguard.validation;

/**
 * @param autoHeal   run the auto-healer once when a healable finding is present
 * @param strictMode treat every finding in the error list, whatever its severity, as invalidating
 */
public record ValidationOptions(boolean autoHeal, boolean strictMode) {

    public static final ValidationOptions DEFAULTS = new ValidationOptions(true, false);
}
