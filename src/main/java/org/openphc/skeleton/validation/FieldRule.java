package org.openphc.skeleton.validation;

import org.openphc.skeleton.domain.model.Violation;

import java.util.Map;
import java.util.Optional;

/**
 * One check against one request field, with the message reported when it fails.
 * An optional rule is satisfied when the field is absent.
 */
public record FieldRule(String field, FieldCheck check, String message, boolean optional) {

    public static FieldRule of(String field, FieldCheck check, String message) {
        return new FieldRule(field, check, message, false);
    }

    public static FieldRule optional(String field, FieldCheck check, String message) {
        return new FieldRule(field, check, message, true);
    }

    public Optional<Violation> evaluate(Map<String, ?> payload) {
        Object value = payload.get(field);
        if (optional && value == null) {
            return Optional.empty();
        }
        return check.test(value) ? Optional.empty() : Optional.of(new Violation(field, message));
    }
}
