package org.openphc.skeleton.security;

import java.time.Instant;

/**
 * Identity extracted from a verified bearer token.
 */
public record AuthenticatedUser(String subject, String role, Instant issuedAt, Instant expiresAt) {}
