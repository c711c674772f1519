package com.kotsin.structure.exception;

import java.util.List;

/**
 * Malformed execution context or out-of-order bar input. Raised before any
 * computation or I/O for the affected invocation.
 */
public class ValidationException extends StructureException {

    private final List<String> violations;

    public ValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public ValidationException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
