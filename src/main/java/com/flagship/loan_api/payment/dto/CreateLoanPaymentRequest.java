package com.flagship.loan_api.payment.dto;

import lombok.Value;

import java.time.LocalDate;

/**
 * REST request for creating a payment, after protocol-level parsing.
 *
 * Wire form: {"loan_id": 2, "payment_date": "2025-05-05"}.
 */
@Value
public class CreateLoanPaymentRequest {
    int loanId;
    LocalDate paymentDate;
}
