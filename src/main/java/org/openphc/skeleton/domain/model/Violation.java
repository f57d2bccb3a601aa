package org.openphc.skeleton.domain.model;

/**
 * A single field-level validation failure: {@code {field, message}} on the wire.
 */
public record Violation(String field, String message) {}
