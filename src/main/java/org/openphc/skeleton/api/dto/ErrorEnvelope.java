package org.openphc.skeleton.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import org.openphc.skeleton.domain.model.Violation;

import java.util.List;

/**
 * Error envelope written for every failed request:
 * { "status", "message", "errors", "errorDetail", "stackTrace" }.
 * The numeric status travels on the HTTP status line only.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "message", "errors", "errorDetail", "stackTrace"})
public class ErrorEnvelope {

    public static final String STATUS_FAIL = "fail";
    public static final String STATUS_ERROR = "error";

    @JsonIgnore
    int statusCode;

    String status;
    String message;

    List<Violation> errors;

    /** Non-production only. */
    ErrorDetail errorDetail;

    /** Non-production only. */
    String stackTrace;

    public static String statusFor(int statusCode) {
        return String.valueOf(statusCode).startsWith("4") ? STATUS_FAIL : STATUS_ERROR;
    }
}
