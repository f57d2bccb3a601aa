package org.openphc.skeleton.validation;

import jakarta.validation.Validator;
import jakarta.validation.metadata.PropertyDescriptor;

import java.math.BigDecimal;

/**
 * Field checks backed by Bean Validation constraints declared on request DTOs.
 * Raw payload values are coerced to the declared property type first; a value that cannot be
 * coerced is checked as {@code null}.
 */
public final class FieldChecks {

    private FieldChecks() {
    }

    /**
     * Check that passes when the value satisfies every constraint of {@code group} declared on
     * {@code property} of {@code beanType}.
     *
     * @throws IllegalArgumentException if the property carries no constraints
     */
    public static FieldCheck constrainedBy(Validator validator, Class<?> beanType, String property, Class<?> group) {
        PropertyDescriptor descriptor = validator.getConstraintsForClass(beanType).getConstraintsForProperty(property);
        if (descriptor == null) {
            throw new IllegalArgumentException(beanType.getSimpleName() + "." + property + " has no constraints");
        }
        Class<?> propertyType = descriptor.getElementClass();
        return value -> validator.validateValue(beanType, property, coerce(value, propertyType), group).isEmpty();
    }

    static Object coerce(Object value, Class<?> propertyType) {
        if (value == null) {
            return null;
        }
        if (propertyType == String.class) {
            return String.valueOf(value);
        }
        if (propertyType == BigDecimal.class) {
            return decimal(value);
        }
        return propertyType.isInstance(value) ? value : null;
    }

    private static BigDecimal decimal(Object value) {
        if (value instanceof Boolean) {
            return null;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
