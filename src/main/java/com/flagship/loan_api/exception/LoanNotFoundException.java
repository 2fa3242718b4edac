package com.flagship.loan_api.exception;

/**
 * A payment referenced a loan id that does not exist.
 */
public class LoanNotFoundException extends LoanApiException {

    private final int loanId;

    public LoanNotFoundException(int loanId) {
        super("Loan with id " + loanId + " not found");
        this.loanId = loanId;
    }

    public int getLoanId() {
        return loanId;
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.LOAN_NOT_FOUND;
    }
}
