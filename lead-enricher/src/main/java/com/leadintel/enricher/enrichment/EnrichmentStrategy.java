package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.model.BusinessRecord;

import java.math.BigDecimal;

/**
 * One way of finding emails for a business. Strategies are selected and ordered by name
 * from lead-enricher.enrichment.strategies.
 *
 * attempt() should report provider failures as an ERROR outcome rather than throw;
 * anything thrown is treated as a failed attempt whose call never completed.
 */
public interface EnrichmentStrategy {

    String name();

    StrategyOutcome attempt(BusinessRecord business);

    default boolean supports(BusinessRecord business) {
        return business.hasWebsite();
    }

    /** Billable strategies are authorized with the CostGovernor before every attempt. */
    default boolean billable() {
        return false;
    }

    default String provider() {
        return name();
    }

    default String endpoint() {
        return name();
    }

    default BigDecimal estimatedCost(BusinessRecord business) {
        return BigDecimal.ZERO;
    }
}
