package com.flagship.loan_api.exception;

import java.util.List;

/**
 * One or more required inputs were absent. Names every missing field.
 */
public class MissingFieldException extends LoanApiException {

    private final List<String> fields;

    public MissingFieldException(List<String> fields) {
        super("Missing required fields: " + String.join(", ", fields));
        this.fields = List.copyOf(fields);
    }

    @Override
    public List<String> getFields() {
        return fields;
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.MISSING_FIELD;
    }
}
