package com.leadintel.enricher.budget;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A budget reservation handed out by {@link CostGovernor#authorize}. Must be settled exactly once,
 * with {@link CostGovernor#record} when the call completed or {@link CostGovernor#release} when it did not.
 */
public record Grant(long id, String provider, String endpoint, BigDecimal estimatedCost, Instant grantedAt) {
}
