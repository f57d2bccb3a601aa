package org.openphc.skeleton.security;

import org.openphc.skeleton.domain.model.Failure;

/**
 * Outcome of verifying a bearer token: either the authenticated user or the failure to report.
 */
public record TokenVerification(AuthenticatedUser user, Failure failure) {

    public static TokenVerification valid(AuthenticatedUser user) {
        return new TokenVerification(user, null);
    }

    public static TokenVerification failed(Failure failure) {
        return new TokenVerification(null, failure);
    }

    public boolean isValid() {
        return failure == null;
    }
}
