package com.flagship.loan_api.payment.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.loan_api.exception.InvalidFormatException;
import com.flagship.loan_api.exception.InvalidTypeException;
import com.flagship.loan_api.exception.MalformedRequestException;
import com.flagship.loan_api.exception.MissingFieldException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Protocol-level validation for the REST payment endpoint.
 *
 * Checks, in order: the body is a JSON object, both keys are present,
 * loan_id coerces to an int, payment_date is a strict yyyy-MM-dd date.
 * The loan reference is checked later by the payment service.
 */
@Component
public class PaymentRequestParser {

    static final String LOAN_ID = "loan_id";
    static final String PAYMENT_DATE = "payment_date";

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    public CreateLoanPaymentRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object");
        }

        List<String> missing = new ArrayList<>();
        if (isAbsent(body.get(LOAN_ID))) {
            missing.add(LOAN_ID);
        }
        if (isAbsent(body.get(PAYMENT_DATE))) {
            missing.add(PAYMENT_DATE);
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing);
        }

        return new CreateLoanPaymentRequest(
            parseLoanId(body.get(LOAN_ID)),
            parsePaymentDate(body.get(PAYMENT_DATE))
        );
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }

    /**
     * Accepts JSON integers, integral numbers such as 2.0, and strings
     * holding an integer.
     */
    private int parseLoanId(JsonNode node) {
        if (node.isNumber() && node.canConvertToExactIntegral() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new InvalidTypeException(LOAN_ID, "an integer");
            }
        }
        throw new InvalidTypeException(LOAN_ID, "an integer");
    }

    private LocalDate parsePaymentDate(JsonNode node) {
        if (!node.isTextual()) {
            throw new InvalidFormatException(PAYMENT_DATE, "YYYY-MM-DD");
        }
        try {
            return LocalDate.parse(node.textValue(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidFormatException(PAYMENT_DATE, "YYYY-MM-DD");
        }
    }
}
