package com.flagship.loan_api.graphql;

import lombok.Value;

import java.time.LocalDate;

/**
 * GraphQL {@code CreateLoanPaymentInput}.
 */
@Value
public class CreateLoanPaymentInput {
    Integer loanId;
    LocalDate paymentDate;
}
