package com.flagship.loan_api.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.payment.dto.CreateLoanPaymentRequest;
import com.flagship.loan_api.payment.dto.PaymentRequestParser;
import com.flagship.loan_api.payment.dto.PaymentResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint for creating loan payments.
 *
 * Same business rule as the createLoanPayment GraphQL mutation, plus
 * protocol-level checks on the raw JSON body. Failures are mapped to status
 * codes by {@link com.flagship.loan_api.exception.GlobalExceptionHandler}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentRequestParser requestParser;
    private final PaymentService paymentService;

    /**
     * Creates a payment.
     *
     * @param body Raw request body: {"loan_id": int, "payment_date": "YYYY-MM-DD"}
     * @return 201 with the created payment
     */
    @PostMapping("/loan-payments")
    public ResponseEntity<PaymentResponse> createPayment(@RequestBody JsonNode body) {
        log.info("Received payment creation request");

        CreateLoanPaymentRequest request = requestParser.parse(body);
        Payment payment = paymentService.createPayment(
            request.getLoanId(),
            request.getPaymentDate(),
            LoanMetrics.SURFACE_REST
        );

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PaymentResponse.from(payment));
    }
}
