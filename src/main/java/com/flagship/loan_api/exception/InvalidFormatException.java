package com.flagship.loan_api.exception;

import java.util.List;

/**
 * A text field did not match its required format.
 */
public class InvalidFormatException extends LoanApiException {

    private final String field;

    public InvalidFormatException(String field, String expectedFormat) {
        super(String.format("Field '%s' must be in %s format", field, expectedFormat));
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
        return ErrorCode.INVALID_FORMAT;
    }
}
