package com.sentinel.core.error;

import java.util.List;

/**
 * Thrown when required fields are missing or malformed. Caller-correctable.
 */
public class ValidationException extends GovernanceException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> violations) {
        super(violations.isEmpty() ? message : message + ": " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
