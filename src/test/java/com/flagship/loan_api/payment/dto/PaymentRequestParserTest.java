package com.flagship.loan_api.payment.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.loan_api.exception.InvalidFormatException;
import com.flagship.loan_api.exception.InvalidTypeException;
import com.flagship.loan_api.exception.MalformedRequestException;
import com.flagship.loan_api.exception.MissingFieldException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentRequestParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PaymentRequestParser parser = new PaymentRequestParser();

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    @Test
    @DisplayName("Integer loan_id and ISO date parse")
    void testParseValidRequest() throws Exception {
        CreateLoanPaymentRequest request = parser.parse(json("{\"loan_id\": 2, \"payment_date\": \"2025-05-05\"}"));

        assertEquals(2, request.getLoanId());
        assertEquals(LocalDate.of(2025, 5, 5), request.getPaymentDate());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"2\"", "2", "2.0", "\" 2 \""})
    @DisplayName("loan_id coercible to an integer is accepted")
    void testLoanIdCoercion(String loanId) throws Exception {
        CreateLoanPaymentRequest request = parser.parse(
            json("{\"loan_id\": " + loanId + ", \"payment_date\": \"2025-05-05\"}"));

        assertEquals(2, request.getLoanId());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"abc\"", "2.5", "true", "[2]", "{\"id\": 2}", "\"\""})
    @DisplayName("loan_id not coercible to an integer is rejected")
    void testLoanIdInvalidType(String loanId) throws Exception {
        JsonNode body = json("{\"loan_id\": " + loanId + ", \"payment_date\": \"2025-05-05\"}");

        InvalidTypeException e = assertThrows(InvalidTypeException.class, () -> parser.parse(body));
        assertEquals("loan_id", e.getField());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"2025-5-5\"", "\"05/05/2025\"", "\"2025-02-30\"", "\"2025-05-05T10:00:00\"", "20250505"})
    @DisplayName("payment_date outside strict YYYY-MM-DD is rejected")
    void testPaymentDateInvalidFormat(String date) throws Exception {
        JsonNode body = json("{\"loan_id\": 2, \"payment_date\": " + date + "}");

        InvalidFormatException e = assertThrows(InvalidFormatException.class, () -> parser.parse(body));
        assertEquals("payment_date", e.getField());
    }

    @Test
    @DisplayName("Leap day parses in a leap year")
    void testLeapDay() throws Exception {
        CreateLoanPaymentRequest request = parser.parse(json("{\"loan_id\": 1, \"payment_date\": \"2024-02-29\"}"));

        assertEquals(LocalDate.of(2024, 2, 29), request.getPaymentDate());
    }

    @Test
    @DisplayName("Both missing keys are named")
    void testMissingFields() throws Exception {
        MissingFieldException e = assertThrows(MissingFieldException.class, () -> parser.parse(json("{}")));

        assertEquals(List.of("loan_id", "payment_date"), e.getFields());
    }

    @Test
    @DisplayName("Explicit null counts as missing")
    void testNullFieldIsMissing() throws Exception {
        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> parser.parse(json("{\"loan_id\": null, \"payment_date\": \"2025-05-05\"}")));

        assertEquals(List.of("loan_id"), e.getFields());
    }

    @Test
    @DisplayName("Body that is not a JSON object is malformed")
    void testNonObjectBody() throws Exception {
        assertThrows(MalformedRequestException.class, () -> parser.parse(json("[1, 2]")));
        assertThrows(MalformedRequestException.class, () -> parser.parse(json("\"text\"")));
        assertThrows(MalformedRequestException.class, () -> parser.parse(null));
    }
}
