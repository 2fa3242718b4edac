package com.flagship.loan_api.payment;

import com.flagship.loan_api.exception.LoanApiException;
import com.flagship.loan_api.observability.CorrelationContext;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.store.RecordStore;
import com.flagship.loan_api.validation.RecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Read and create operations for loan payments.
 *
 * Both the GraphQL mutation and the REST endpoint create payments through
 * {@link #createPayment}, so the referential rule lives in one place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final RecordStore store;
    private final RecordValidator validator;
    private final LoanMetrics metrics;

    public List<Payment> listPayments() {
        return store.listPayments();
    }

    /**
     * Creates a payment against an existing loan.
     *
     * Required fields and the loan reference are checked before an id is
     * assigned; a rejected request stores nothing.
     *
     * @param loanId Referenced loan id
     * @param paymentDate Date of payment
     * @param surface Entry point, for metrics
     * @return The stored payment
     * @throws com.flagship.loan_api.exception.MissingFieldException if a field is absent
     * @throws com.flagship.loan_api.exception.LoanNotFoundException if the loan does not exist
     */
    public Payment createPayment(Integer loanId, LocalDate paymentDate, String surface) {
        long startTime = System.currentTimeMillis();
        try {
            validator.requirePaymentFields(loanId, paymentDate);
            validator.requireExistingLoan(loanId);

            Payment payment = store.insertPayment(loanId, paymentDate);

            MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, String.valueOf(loanId));
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, String.valueOf(payment.getId()));
            metrics.recordPaymentCreated(surface, "success");
            log.info("Payment created: loanId={}, paymentDate={}, surface={}",
                    loanId, paymentDate, surface);
            return payment;

        } catch (LoanApiException e) {
            metrics.recordPaymentCreated(surface, e.getCode().name());
            log.warn("Payment creation rejected: loanId={}, code={}, error={}",
                    loanId, e.getCode(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("create_payment", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }
}
