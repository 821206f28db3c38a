package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.model.EmailCandidate;

import java.math.BigDecimal;
import java.util.List;

/**
 * What one strategy attempt produced.
 *
 * @param cost actual cost of a completed billable call (zero for free strategies);
 *             null when no call completed, so any budget reservation is released
 */
public record StrategyOutcome(Kind kind, List<EmailCandidate> candidates, String contactName,
                              BigDecimal cost, String error) {

    public enum Kind { MATCH, NO_MATCH, ERROR }

    public StrategyOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static StrategyOutcome match(List<EmailCandidate> candidates, String contactName, BigDecimal cost) {
        return new StrategyOutcome(Kind.MATCH, candidates, contactName, cost, null);
    }

    public static StrategyOutcome noMatch(BigDecimal cost) {
        return new StrategyOutcome(Kind.NO_MATCH, List.of(), null, cost, null);
    }

    public static StrategyOutcome error(String error, BigDecimal cost) {
        return new StrategyOutcome(Kind.ERROR, List.of(), null, cost, error);
    }
}
