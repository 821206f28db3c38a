package com.leadintel.enricher.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only view of one budget window for reporting. Null limits mean "unlimited".
 */
public record BudgetWindowSummary(
        WindowKind kind,
        String scope,
        Instant windowStart,
        long requestCount,
        BigDecimal cumulativeCost,
        BigDecimal costLimit,
        BigDecimal remainingCost,
        Long requestLimit,
        Long remainingRequests) {
}
