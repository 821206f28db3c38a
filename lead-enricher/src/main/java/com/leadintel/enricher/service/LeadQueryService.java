package com.leadintel.enricher.service;

import com.leadintel.enricher.budget.CostGovernor;
import com.leadintel.enricher.model.CostLedgerReport;
import com.leadintel.enricher.model.Lead;
import com.leadintel.enricher.store.BusinessRepository;
import com.leadintel.enricher.store.CostLedgerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side: leads for export and the cost ledger.
 */
@Service
@RequiredArgsConstructor
public class LeadQueryService {

    private final BusinessRepository businessRepository;
    private final CostLedgerRepository costLedger;
    private final CostGovernor governor;
    private final PagedSearch pagedSearch;
    private final JobOrchestrator orchestrator;
    private final Clock clock;

    public List<Lead> leadsForJob(String jobId) {
        orchestrator.find(jobId);
        return businessRepository.findLeadsForJob(jobId);
    }

    public List<Lead> recentLeads(int limit) {
        return businessRepository.findLeads(limit);
    }

    /**
     * Spend per provider over the last {@code days} days plus a "summary" total.
     */
    public Map<String, Map<String, Object>> costSummary(int days) {
        if (days <= 0) throw new IllegalArgumentException("days must be positive");
        return costLedger.summaryByProvider(clock.instant().minus(Duration.ofDays(days)));
    }

    /** Raw events of the last {@code days} days with the current budget windows. */
    public CostLedgerReport costLedger(int days) {
        if (days <= 0) throw new IllegalArgumentException("days must be positive");
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return new CostLedgerReport(costLedger.findSince(since), governor.summaries());
    }

    /** Pre-flight estimate for a search: pages needed and worst-case search spend. */
    public Map<String, Object> estimate(int maxResults) {
        if (maxResults <= 0) throw new IllegalArgumentException("max_results must be positive");
        BigDecimal searchCost = pagedSearch.estimateCost(maxResults);
        Map<String, Object> estimate = new LinkedHashMap<>();
        estimate.put("max_results", maxResults);
        estimate.put("estimated_search_cost", searchCost);
        estimate.put("budget_windows", governor.summaries());
        return estimate;
    }
}
