package com.flagship.loan_api.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds surfaced to API callers, with the HTTP status each maps to.
 */
public enum ErrorCode {
    MISSING_FIELD(HttpStatus.BAD_REQUEST),
    LOAN_NOT_FOUND(HttpStatus.NOT_FOUND),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST),
    INVALID_TYPE(HttpStatus.BAD_REQUEST),
    INVALID_FORMAT(HttpStatus.BAD_REQUEST),
    INTERNAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
