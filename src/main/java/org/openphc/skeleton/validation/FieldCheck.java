package org.openphc.skeleton.validation;

/**
 * Pure predicate over a single field value. The value is {@code null} when the field is absent.
 */
@FunctionalInterface
public interface FieldCheck {

    boolean test(Object value);
}
