package com.flagship.loan_api.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for loan and payment operations.
 *
 * Metrics exposed:
 * - loan.created: Counter of loan creations, tagged by outcome
 * - loan.payment.created: Counter of payment creations, tagged by surface and outcome
 * - loan.api.latency: Timer for mutations, tagged by operation
 * - loan.store.size: Gauges for collection sizes
 */
@Component
public class LoanMetrics {

    public static final String SURFACE_GRAPHQL = "graphql";
    public static final String SURFACE_REST = "rest";
    public static final String SURFACE_SEED = "seed";

    private final MeterRegistry registry;

    public LoanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a loan creation attempt.
     *
     * @param outcome "success" or the error code of the failure
     */
    public void recordLoanCreated(String outcome) {
        registry.counter("loan.created",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Records a payment creation attempt.
     *
     * @param surface Entry point the request came through
     * @param outcome "success" or the error code of the failure
     */
    public void recordPaymentCreated(String surface, String outcome) {
        registry.counter("loan.payment.created",
                "surface", sanitizeTag(surface),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("loan.api.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers a gauge reporting the size of one store collection.
     */
    public void registerStoreSizeGauge(String collection, Supplier<Number> supplier) {
        registry.gauge("loan.store.size",
                Tags.of("collection", collection),
                supplier, s -> s.get().doubleValue());
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
