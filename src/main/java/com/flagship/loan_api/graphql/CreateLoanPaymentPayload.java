package com.flagship.loan_api.graphql;

import com.flagship.loan_api.payment.Payment;
import lombok.Value;

@Value
public class CreateLoanPaymentPayload {
    Payment payment;
}
