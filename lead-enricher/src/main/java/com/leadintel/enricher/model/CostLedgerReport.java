package com.leadintel.enricher.model;

import java.util.List;

/**
 * Cost ledger export: raw events plus the current window summaries.
 */
public record CostLedgerReport(List<CostEvent> events, List<BudgetWindowSummary> windows) {
}
