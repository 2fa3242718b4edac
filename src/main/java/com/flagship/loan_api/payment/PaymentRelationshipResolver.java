package com.flagship.loan_api.payment;

import com.flagship.loan_api.loan.Loan;
import com.flagship.loan_api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives a loan's payments from the payment collection.
 *
 * Recomputed on every read; the store is small and in memory, so there is no
 * index by loan id.
 */
@Component
@RequiredArgsConstructor
public class PaymentRelationshipResolver {

    private final RecordStore store;

    /**
     * @return Payments whose loanId equals the loan's id, in insertion order
     */
    public List<Payment> paymentsFor(Loan loan) {
        return store.listPayments().stream()
            .filter(payment -> payment.getLoanId() == loan.getId())
            .toList();
    }
}
