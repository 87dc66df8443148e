package com.williamcallahan.pftreport.service.admission;

import java.util.List;

/**
 * Signals a structurally invalid submission. No status entry exists for a rejected submission.
 */
public class SubmissionValidationException extends IllegalArgumentException {

    private final List<String> violations;

    /**
     * Creates the exception from every violation found.
     *
     * @param violations human-readable descriptions, at least one
     */
    public SubmissionValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
