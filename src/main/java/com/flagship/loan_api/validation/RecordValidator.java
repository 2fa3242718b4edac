package com.flagship.loan_api.validation;

import com.flagship.loan_api.exception.LoanNotFoundException;
import com.flagship.loan_api.exception.MissingFieldException;
import com.flagship.loan_api.loan.CreateLoanInput;
import com.flagship.loan_api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Business-rule validation shared by every surface.
 *
 * All checks run before any store mutation, so a rejected request leaves both
 * collections untouched. Field names in errors use the GraphQL names.
 */
@Component
@RequiredArgsConstructor
public class RecordValidator {

    private final RecordStore store;

    /**
     * Requires name, interestRate, principal and dueDate. A blank name counts
     * as missing.
     *
     * @throws MissingFieldException naming every missing field
     */
    public void requireLoanFields(CreateLoanInput input) {
        List<String> missing = new ArrayList<>();
        if (input == null || input.getName() == null || input.getName().isBlank()) {
            missing.add("name");
        }
        if (input == null || input.getInterestRate() == null) {
            missing.add("interestRate");
        }
        if (input == null || input.getPrincipal() == null) {
            missing.add("principal");
        }
        if (input == null || input.getDueDate() == null) {
            missing.add("dueDate");
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing);
        }
    }

    /**
     * @throws MissingFieldException naming every missing field
     */
    public void requirePaymentFields(Integer loanId, LocalDate paymentDate) {
        List<String> missing = new ArrayList<>();
        if (loanId == null) {
            missing.add("loanId");
        }
        if (paymentDate == null) {
            missing.add("paymentDate");
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing);
        }
    }

    /**
     * @throws LoanNotFoundException if no loan has this id
     */
    public void requireExistingLoan(int loanId) {
        if (!store.loanExists(loanId)) {
            throw new LoanNotFoundException(loanId);
        }
    }
}
