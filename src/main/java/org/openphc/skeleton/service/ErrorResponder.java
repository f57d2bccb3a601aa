package org.openphc.skeleton.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.ErrorEnvelope;
import org.openphc.skeleton.config.AppConfiguration;
import org.openphc.skeleton.domain.model.Failure;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Single terminal point for error responses. Every failure, whether returned by a handler,
 * translated from an exception or raised by the authentication interceptor, ends up here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorResponder {

    static final String ERROR_COUNTER = "api.errors";

    private final ErrorClassifier errorClassifier;
    private final AppConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;

    /**
     * Classify the failure and build the response for a controller or exception handler to return.
     */
    public ResponseEntity<ErrorEnvelope> respond(Failure failure, HttpServletRequest request) {
        ErrorEnvelope envelope = prepare(failure, request);
        return ResponseEntity.status(envelope.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(envelope);
    }

    /**
     * Classify the failure and write it straight to the servlet response, for callers that run
     * before a controller is chosen.
     */
    public void write(Failure failure, HttpServletRequest request, HttpServletResponse response) throws IOException {
        ErrorEnvelope envelope = prepare(failure, request);
        response.setStatus(envelope.getStatusCode());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), envelope);
    }

    private ErrorEnvelope prepare(Failure failure, HttpServletRequest request) {
        if (configuration.isDevelopment()) {
            log.error("Error on {} {}: {}", request.getMethod(), request.getRequestURI(), failure, failure.getCause());
        }

        ErrorEnvelope envelope = errorClassifier.classify(failure, configuration.isProduction());

        if (!configuration.isDevelopment()) {
            if (envelope.getStatusCode() >= 500) {
                log.error("Request {} {} failed: status={}, kind={}", request.getMethod(), request.getRequestURI(),
                        envelope.getStatusCode(), failure.getKind(), failure.getCause());
            } else {
                log.warn("Request {} {} rejected: status={}, kind={}, message={}", request.getMethod(),
                        request.getRequestURI(), envelope.getStatusCode(), failure.getKind(), envelope.getMessage());
            }
        }

        meterRegistry.counter(ERROR_COUNTER,
                "kind", failure.getKind().name(),
                "status", String.valueOf(envelope.getStatusCode())).increment();
        return envelope;
    }
}
