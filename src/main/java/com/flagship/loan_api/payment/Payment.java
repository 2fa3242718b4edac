package com.flagship.loan_api.payment;

import lombok.Value;

import java.time.LocalDate;

/**
 * A payment made against a loan.
 *
 * {@code loanId} referenced an existing loan when the payment was created.
 */
@Value
public class Payment {
    int id;
    int loanId;
    LocalDate paymentDate;
}
