package org.openphc.skeleton.api.exception;

/**
 * Exception thrown when a resource collides with an existing unique value.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String field, Object value) {
        super("Duplicate value for " + field + ": " + value);
    }
}
