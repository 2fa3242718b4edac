package com.flagship.loan_api.health;

import com.flagship.loan_api.store.RecordStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Reports the record store's current sizes.
 */
@RestController
public class HealthController {

    private final RecordStore store;

    public HealthController(RecordStore store) {
        this.store = store;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("loans", store.loanCount());
        response.put("payments", store.paymentCount());
        return ResponseEntity.ok(response);
    }
}
