package com.leadintel.enricher.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One billable call in the append-only cost ledger.
 */
public record CostEvent(
        Long id,
        String provider,
        String endpoint,
        BigDecimal cost,
        Instant timestamp,
        boolean success,
        String errorMessage) {

    public CostEvent {
        if (cost == null || cost.signum() < 0) {
            throw new IllegalArgumentException("cost must be >= 0, was " + cost);
        }
    }
}
