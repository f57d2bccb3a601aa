package org.openphc.skeleton.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.openphc.skeleton.domain.model.enums.FailureKind;

import java.util.List;

/**
 * Normalized record of something that went wrong while serving a request.
 * Built at the point of failure, consumed once by the error responder, never persisted.
 */
@Value
@Builder
public class Failure {

    @NonNull
    FailureKind kind;

    String rawMessage;

    /** Caller-supplied HTTP status; only honoured for {@link FailureKind#UNCLASSIFIED}. */
    Integer statusCodeHint;

    /** Expected, user-facing condition as opposed to an internal fault. */
    boolean operational;

    @Singular
    List<Violation> violations;

    Throwable cause;

    public static Failure typeMismatch(Throwable cause) {
        return Failure.builder()
                .kind(FailureKind.TYPE_MISMATCH)
                .rawMessage(cause.getMessage())
                .operational(true)
                .cause(cause)
                .build();
    }

    public static Failure duplicateKey(String rawMessage, Throwable cause) {
        return Failure.builder()
                .kind(FailureKind.DUPLICATE_KEY)
                .rawMessage(rawMessage)
                .operational(true)
                .cause(cause)
                .build();
    }

    public static Failure validation(List<Violation> violations) {
        return Failure.builder()
                .kind(FailureKind.FIELD_VALIDATION)
                .rawMessage("Validation failed")
                .operational(true)
                .violations(violations)
                .build();
    }

    public static Failure malformedCredential(Throwable cause) {
        return Failure.builder()
                .kind(FailureKind.MALFORMED_CREDENTIAL)
                .rawMessage(cause.getMessage())
                .operational(true)
                .cause(cause)
                .build();
    }

    public static Failure expiredCredential(Throwable cause) {
        return Failure.builder()
                .kind(FailureKind.EXPIRED_CREDENTIAL)
                .rawMessage(cause.getMessage())
                .operational(true)
                .cause(cause)
                .build();
    }

    /**
     * An expected condition raised explicitly by a handler, with its own status and message.
     */
    public static Failure of(int statusCode, String message) {
        return Failure.builder()
                .kind(FailureKind.UNCLASSIFIED)
                .rawMessage(message)
                .statusCodeHint(statusCode)
                .operational(true)
                .build();
    }

    /**
     * An unexpected internal fault.
     */
    public static Failure internal(Throwable cause) {
        return Failure.builder()
                .kind(FailureKind.UNCLASSIFIED)
                .rawMessage(cause.getMessage())
                .operational(false)
                .cause(cause)
                .build();
    }
}
