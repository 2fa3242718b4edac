package com.flagship.loan_api.exception;

/**
 * Request body was not a JSON object.
 */
public class MalformedRequestException extends LoanApiException {

    public MalformedRequestException(String message) {
        super(message);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.MALFORMED_REQUEST;
    }
}
