package com.flagship.loan_api.observability;

import com.flagship.loan_api.store.RecordStore;
import org.springframework.stereotype.Component;

/**
 * Publishes the record store's collection sizes as gauges.
 */
@Component
public class StoreGauges {

    public StoreGauges(LoanMetrics metrics, RecordStore store) {
        metrics.registerStoreSizeGauge("loans", store::loanCount);
        metrics.registerStoreSizeGauge("payments", store::paymentCount);
    }
}
