package com.flagship.loan_api.loan;

import com.flagship.loan_api.payment.Payment;
import com.flagship.loan_api.payment.PaymentRelationshipResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Derived repayment figures for a loan: latest payment, status, months until
 * due and projected simple interest.
 *
 * Nothing here is stored; every value is computed from the current payments.
 */
@Service
@RequiredArgsConstructor
public class RepaymentStatusService {

    static final int ON_TIME_GRACE_DAYS = 5;
    static final int LATE_LIMIT_DAYS = 30;

    private final PaymentRelationshipResolver resolver;
    private final Clock clock;

    /**
     * Most recent payment by payment date. On equal dates the earliest
     * recorded payment wins.
     */
    public Optional<Payment> latestPayment(Loan loan) {
        List<Payment> payments = resolver.paymentsFor(loan);
        Payment latest = null;
        for (Payment payment : payments) {
            if (latest == null || payment.getPaymentDate().isAfter(latest.getPaymentDate())) {
                latest = payment;
            }
        }
        return Optional.ofNullable(latest);
    }

    public RepaymentStatus status(Loan loan) {
        return latestPayment(loan)
            .map(payment -> classify(payment.getPaymentDate(), loan.getDueDate()))
            .orElse(RepaymentStatus.UNPAID);
    }

    /**
     * Classifies a payment date against a due date.
     *
     * @param paymentDate Date paid, or null when unpaid
     * @param dueDate Loan due date
     */
    public RepaymentStatus classify(LocalDate paymentDate, LocalDate dueDate) {
        if (paymentDate == null) {
            return RepaymentStatus.UNPAID;
        }
        if (dueDate == null) {
            return RepaymentStatus.ON_TIME;
        }

        long daysOverdue = ChronoUnit.DAYS.between(dueDate, paymentDate);
        if (daysOverdue <= ON_TIME_GRACE_DAYS) {
            return RepaymentStatus.ON_TIME;
        }
        if (daysOverdue <= LATE_LIMIT_DAYS) {
            return RepaymentStatus.LATE;
        }
        return RepaymentStatus.DEFAULTED;
    }

    /**
     * Whole months from today until the due date, rounded up when the due
     * day-of-month is later than today's. Never negative.
     */
    public int monthsUntilDue(Loan loan) {
        LocalDate today = LocalDate.now(clock);
        LocalDate due = loan.getDueDate();

        int totalMonths = (due.getYear() - today.getYear()) * 12
            + (due.getMonthValue() - today.getMonthValue());
        if (due.getDayOfMonth() > today.getDayOfMonth()) {
            totalMonths += 1;
        }
        return Math.max(0, totalMonths);
    }

    /**
     * Simple interest over the given number of months at the loan's monthly rate.
     *
     * @return principal * rate * months / 100, or empty if principal or rate
     *         is zero or months is not positive
     */
    public Optional<Double> projectedInterest(Loan loan, int months) {
        if (loan.getPrincipal() == 0 || loan.getInterestRate() == 0 || months <= 0) {
            return Optional.empty();
        }
        return Optional.of(loan.getPrincipal() * loan.getInterestRate() * months / 100);
    }
}
