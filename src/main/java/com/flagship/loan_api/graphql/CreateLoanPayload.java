package com.flagship.loan_api.graphql;

import com.flagship.loan_api.loan.Loan;
import lombok.Value;

@Value
public class CreateLoanPayload {
    Loan loan;
}
