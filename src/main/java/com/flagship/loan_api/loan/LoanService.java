package com.flagship.loan_api.loan;

import com.flagship.loan_api.exception.LoanApiException;
import com.flagship.loan_api.observability.CorrelationContext;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.store.RecordStore;
import com.flagship.loan_api.validation.RecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read and create operations for loans.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final RecordStore store;
    private final RecordValidator validator;
    private final LoanMetrics metrics;

    public List<Loan> listLoans() {
        return store.listLoans();
    }

    /**
     * Finds a loan by id. An unknown id is a normal outcome, not an error.
     */
    public Optional<Loan> findLoan(int id) {
        return store.findLoan(id);
    }

    /**
     * Validates and stores a new loan.
     *
     * @param input Caller-supplied fields
     * @return The stored loan with its assigned id
     * @throws com.flagship.loan_api.exception.MissingFieldException if any field is absent;
     *         nothing is stored in that case
     */
    public Loan createLoan(CreateLoanInput input) {
        long startTime = System.currentTimeMillis();
        try {
            validator.requireLoanFields(input);

            Loan loan = store.insertLoan(
                input.getName(),
                input.getInterestRate(),
                input.getPrincipal(),
                input.getDueDate()
            );

            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, String.valueOf(loan.getId()));
            metrics.recordLoanCreated("success");
            log.info("Loan created: name={}, principal={}, interestRate={}, dueDate={}",
                    loan.getName(), loan.getPrincipal(), loan.getInterestRate(), loan.getDueDate());
            return loan;

        } catch (LoanApiException e) {
            metrics.recordLoanCreated(e.getCode().name());
            log.warn("Loan creation rejected: code={}, error={}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("create_loan", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }
}
