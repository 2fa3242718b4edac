package com.flagship.loan_api.loan;

import lombok.Value;

import java.time.LocalDate;

/**
 * Loan domain object.
 *
 * Immutable. Ids are assigned by the record store; payments are not held here
 * but derived on read from the payment collection.
 */
@Value
public class Loan {
    int id;
    String name;
    double interestRate;
    int principal;
    LocalDate dueDate;
}
