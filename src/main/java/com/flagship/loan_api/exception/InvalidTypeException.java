package com.flagship.loan_api.exception;

import java.util.List;

/**
 * A field held a value that cannot be coerced to the expected type.
 */
public class InvalidTypeException extends LoanApiException {

    private final String field;

    public InvalidTypeException(String field, String expectedType) {
        super(String.format("Field '%s' must be %s", field, expectedType));
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public List<String> getFields() {
        return List.of(field);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.INVALID_TYPE;
    }
}
