package com.jay.stfunnel.exception;

import java.util.List;

/**
 * Raised when a build or review request carries a malformed configuration.
 * Fatal for the run: nothing is screened and the run is recorded as failed.
 */
public class PipelineValidationException extends RuntimeException {
    private final List<String> violations;

    public PipelineValidationException(List<String> violations) {
        super("Invalid pipeline configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
