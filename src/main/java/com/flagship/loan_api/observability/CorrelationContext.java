package com.flagship.loan_api.observability;

import java.util.UUID;

/**
 * Correlation id conventions shared by the request filter and the services.
 *
 * The id of the current request lives only in the MDC under
 * {@link #CORRELATION_ID_MDC_KEY}; services add {@link #LOAN_ID_MDC_KEY} and
 * {@link #PAYMENT_ID_MDC_KEY} around mutations.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LOAN_ID_MDC_KEY = "loanId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    static final int MAX_LENGTH = 64;
    private static final int GENERATED_LENGTH = 8;

    private CorrelationContext() {
    }

    /**
     * Picks the correlation id for a request.
     *
     * @param headerValue Value of the X-Correlation-ID header, possibly null
     * @return The trimmed header value capped at {@value #MAX_LENGTH} characters,
     *         or a fresh short id when the header is absent or blank
     */
    public static String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return newId();
        }
        String trimmed = headerValue.trim();
        return trimmed.length() > MAX_LENGTH ? trimmed.substring(0, MAX_LENGTH) : trimmed;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_LENGTH);
    }
}
