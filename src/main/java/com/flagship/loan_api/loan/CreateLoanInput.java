package com.flagship.loan_api.loan;

import lombok.Value;

import java.time.LocalDate;

/**
 * Fields for a new loan, as supplied by a caller.
 *
 * Every field is nullable here; {@link com.flagship.loan_api.validation.RecordValidator}
 * decides which are missing. Bound directly from the GraphQL {@code CreateLoanInput}.
 */
@Value
public class CreateLoanInput {
    String name;
    Double interestRate;
    Integer principal;
    LocalDate dueDate;
}
