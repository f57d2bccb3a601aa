package org.openphc.skeleton.domain.model.enums;

/**
 * Origin of a failure. Declaration order is the classification precedence.
 */
public enum FailureKind {
    TYPE_MISMATCH,
    DUPLICATE_KEY,
    FIELD_VALIDATION,
    MALFORMED_CREDENTIAL,
    EXPIRED_CREDENTIAL,
    UNCLASSIFIED
}
