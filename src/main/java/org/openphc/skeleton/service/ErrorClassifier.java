package org.openphc.skeleton.service;

import org.openphc.skeleton.api.dto.ErrorDetail;
import org.openphc.skeleton.api.dto.ErrorEnvelope;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.domain.model.Violation;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a {@link Failure} to the error envelope sent to the client.
 * Stateless and deterministic: the same failure in the same mode always yields the same envelope.
 */
@Component
public class ErrorClassifier {

    static final String INVALID_ID_FORMAT = "Invalid ID format";
    static final String DUPLICATE_FIELD_VALUE = "Duplicate field value entered";
    static final String INVALID_TOKEN = "Invalid token";
    static final String TOKEN_EXPIRED = "Token expired";
    static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

    private static final int DEFAULT_STATUS = 500;

    /**
     * @param failure    the failure to classify
     * @param production when set, internal details are never attached and 5xx / non-operational
     *                   failures get a generic message
     */
    public ErrorEnvelope classify(Failure failure, boolean production) {
        Classification classification = switch (failure.getKind()) {
            case TYPE_MISMATCH -> new Classification(400, INVALID_ID_FORMAT);
            case DUPLICATE_KEY -> new Classification(400, DUPLICATE_FIELD_VALUE);
            case FIELD_VALIDATION -> new Classification(400, joinMessages(failure.getViolations()));
            case MALFORMED_CREDENTIAL -> new Classification(401, INVALID_TOKEN);
            case EXPIRED_CREDENTIAL -> new Classification(401, TOKEN_EXPIRED);
            case UNCLASSIFIED -> new Classification(statusCodeOf(failure), messageOf(failure));
        };

        int statusCode = classification.statusCode();
        String message = classification.message();
        if (production && (statusCode >= 500 || !failure.isOperational())) {
            message = INTERNAL_SERVER_ERROR;
        }

        ErrorEnvelope.ErrorEnvelopeBuilder envelope = ErrorEnvelope.builder()
                .statusCode(statusCode)
                .status(ErrorEnvelope.statusFor(statusCode))
                .message(message);

        if (!failure.getViolations().isEmpty()) {
            envelope.errors(failure.getViolations());
        }

        if (!production) {
            envelope.errorDetail(ErrorDetail.builder()
                    .kind(failure.getKind().name())
                    .statusCode(statusCode)
                    .operational(failure.isOperational())
                    .rawMessage(failure.getRawMessage())
                    .exception(failure.getCause() != null ? failure.getCause().getClass().getName() : null)
                    .build());
            envelope.stackTrace(stackTraceOf(failure.getCause()));
        }

        return envelope.build();
    }

    private static String joinMessages(List<Violation> violations) {
        return violations.stream()
                .map(Violation::message)
                .collect(Collectors.joining(", "));
    }

    private static int statusCodeOf(Failure failure) {
        Integer hint = failure.getStatusCodeHint();
        if (hint == null || hint < 100 || hint > 599) {
            return DEFAULT_STATUS;
        }
        return hint;
    }

    private static String messageOf(Failure failure) {
        String raw = failure.getRawMessage();
        return raw == null || raw.isBlank() ? INTERNAL_SERVER_ERROR : raw;
    }

    private static String stackTraceOf(Throwable cause) {
        if (cause == null) {
            return null;
        }
        StringWriter writer = new StringWriter();
        cause.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private record Classification(int statusCode, String message) {}
}
