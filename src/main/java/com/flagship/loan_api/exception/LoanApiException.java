package com.flagship.loan_api.exception;

import java.util.List;

/**
 * Base class for expected, caller-visible failures.
 *
 * Thrown by the validation layer before any store mutation and translated to
 * a protocol response at each surface (HTTP status + body, or GraphQL error).
 */
public abstract class LoanApiException extends RuntimeException {

    protected LoanApiException(String message) {
        super(message);
    }

    public abstract ErrorCode getCode();

    /**
     * Request fields this failure concerns; empty when it is not tied to a field.
     */
    public List<String> getFields() {
        return List.of();
    }
}
