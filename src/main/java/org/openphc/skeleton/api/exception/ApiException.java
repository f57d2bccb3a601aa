package org.openphc.skeleton.api.exception;

import lombok.Getter;

/**
 * Expected, user-facing failure raised with an explicit HTTP status and message.
 */
@Getter
public class ApiException extends RuntimeException {

    private final int statusCode;

    public ApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
