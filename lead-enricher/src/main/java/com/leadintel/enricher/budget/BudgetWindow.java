package com.leadintel.enricher.budget;

import com.leadintel.enricher.model.WindowKind;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Counters for one (scope, window kind). Not thread-safe: only touched under the CostGovernor lock.
 *
 * requestCount/cumulativeCost mirror the ledger; reserved* hold outstanding grants that
 * have been authorized but not yet recorded or released.
 */
@Getter
class BudgetWindow {

    private final WindowKind kind;
    private final String scope;
    private Instant windowStart;
    private long requestCount;
    private BigDecimal cumulativeCost;
    private long reservedRequests;
    private BigDecimal reservedCost = BigDecimal.ZERO;

    BudgetWindow(WindowKind kind, String scope, Instant windowStart, long requestCount, BigDecimal cumulativeCost) {
        this.kind = kind;
        this.scope = scope;
        this.windowStart = windowStart;
        this.requestCount = requestCount;
        this.cumulativeCost = cumulativeCost;
    }

    /** Starts a new period. Outstanding reservations carry over, they settle into the new window. */
    void rollTo(Instant newStart) {
        windowStart = newStart;
        requestCount = 0;
        cumulativeCost = BigDecimal.ZERO;
    }

    void reserve(BigDecimal estimate) {
        reservedRequests++;
        reservedCost = reservedCost.add(estimate);
    }

    void unreserve(BigDecimal estimate) {
        reservedRequests = Math.max(0, reservedRequests - 1);
        reservedCost = reservedCost.subtract(estimate).max(BigDecimal.ZERO);
    }

    void add(BigDecimal cost) {
        requestCount++;
        cumulativeCost = cumulativeCost.add(cost);
    }

    BigDecimal committedCost() {
        return cumulativeCost.add(reservedCost);
    }

    long committedRequests() {
        return requestCount + reservedRequests;
    }
}
