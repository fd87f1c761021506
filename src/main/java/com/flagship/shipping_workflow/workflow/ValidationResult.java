package com.flagship.shipping_workflow.workflow;

import lombok.Value;

/**
 * Outcome of validating a single raw input. On success {@code value} holds the
 * normalized form that gets stored.
 */
@Value
public class ValidationResult {
    boolean valid;
    String value;
    String error;

    public static ValidationResult ok(String normalized) {
        return new ValidationResult(true, normalized, null);
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(false, null, message);
    }
}
