package org.openphc.skeleton.validation;

import org.openphc.skeleton.domain.model.Violation;

import java.util.List;

/**
 * Violations collected for one request, in rule declaration order. Empty means valid.
 */
public record ValidationResult(List<Violation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of());
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
