package org.openphc.skeleton.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Diagnostic view of the original failure, attached to error envelopes outside production.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorDetail {

    String kind;
    int statusCode;
    boolean operational;
    String rawMessage;
    String exception;
}
