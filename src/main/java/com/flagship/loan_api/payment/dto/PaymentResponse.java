package com.flagship.loan_api.payment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_api.payment.Payment;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * REST response for a created payment.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    int id;

    @JsonProperty("loan_id")
    int loanId;

    @JsonProperty("payment_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate paymentDate;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .loanId(payment.getLoanId())
            .paymentDate(payment.getPaymentDate())
            .build();
    }
}
