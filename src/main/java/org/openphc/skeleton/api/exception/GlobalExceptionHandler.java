package org.openphc.skeleton.api.exception;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.openphc.skeleton.api.dto.ErrorEnvelope;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.domain.model.Violation;
import org.openphc.skeleton.service.ErrorResponder;
import org.springframework.beans.TypeMismatchException;
import org.springframework.core.convert.ConversionFailedException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * Global exception handler — translates exceptions escaping any controller into failures and
 * hands them to the {@link ErrorResponder}.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponder errorResponder;

    @ExceptionHandler({TypeMismatchException.class, ConversionFailedException.class})
    public ResponseEntity<ErrorEnvelope> handleTypeMismatch(RuntimeException ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.typeMismatch(ex), request);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorEnvelope> handleDuplicate(DuplicateResourceException ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.duplicateKey(ex.getMessage(), ex), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorEnvelope> handleBeanValidation(MethodArgumentNotValidException ex,
                                                              HttpServletRequest request) {
        List<Violation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new Violation(e.getField(), e.getDefaultMessage()))
                .toList();
        return errorResponder.respond(Failure.validation(violations), request);
    }

    @ExceptionHandler(ExpiredJwtException.class)
    public ResponseEntity<ErrorEnvelope> handleExpiredToken(ExpiredJwtException ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.expiredCredential(ex), request);
    }

    @ExceptionHandler(JwtException.class)
    public ResponseEntity<ErrorEnvelope> handleInvalidToken(JwtException ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.malformedCredential(ex), request);
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorEnvelope> handleApiException(ApiException ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.of(ex.getStatusCode(), ex.getMessage()), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorEnvelope> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        return errorResponder.respond(Failure.of(400, "Malformed request body"), request);
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorEnvelope> handleRouteNotFound(Exception ex, HttpServletRequest request) {
        return errorResponder.respond(Failure.of(404, "Route not found: " + request.getRequestURI()), request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorEnvelope> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex,
                                                                HttpServletRequest request) {
        return errorResponder.respond(
                Failure.of(405, "Method " + ex.getMethod() + " not allowed on " + request.getRequestURI()), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorEnvelope> handleGeneric(Exception ex, HttpServletRequest request) {
        // Remaining Spring MVC exceptions already carry a client-facing status
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            return errorResponder.respond(
                    Failure.of(errorResponse.getStatusCode().value(), errorResponse.getBody().getDetail()), request);
        }
        return errorResponder.respond(Failure.internal(ex), request);
    }
}
