package com.medform.backend.services.forms.normalize;

import java.util.List;

/**
 * Collected validation problems. {@code requiredFieldsPresent} is false when any mandatory
 * source field is missing or empty; all other problems are advisory.
 */
public record ValidationReport(List<String> errors, boolean requiredFieldsPresent) {

    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isClean() {
        return errors.isEmpty();
    }
}
