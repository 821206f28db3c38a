package com.leadintel.enricher.service;

import com.leadintel.enricher.budget.CostGovernor;
import com.leadintel.enricher.model.CostLedgerReport;
import com.leadintel.enricher.store.BusinessRepository;
import com.leadintel.enricher.store.CostLedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadQueryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    @Mock
    private BusinessRepository businessRepository;
    @Mock
    private CostLedgerRepository costLedger;
    @Mock
    private CostGovernor governor;
    @Mock
    private PagedSearch pagedSearch;
    @Mock
    private JobOrchestrator orchestrator;

    private LeadQueryService service;

    @BeforeEach
    void setUp() {
        service = new LeadQueryService(businessRepository, costLedger, governor, pagedSearch, orchestrator,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void costSummaryCoversTheRequestedDays() {
        Map<String, Map<String, Object>> summary = Map.of("summary", Map.of("total_calls", 0L));
        when(costLedger.summaryByProvider(Instant.parse("2026-02-02T10:00:00Z"))).thenReturn(summary);

        assertThat(service.costSummary(30)).isSameAs(summary);
    }

    @Test
    void nonPositiveDaysRejected() {
        assertThatThrownBy(() -> service.costSummary(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.costLedger(-1)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(costLedger);
    }

    @Test
    void ledgerCombinesEventsAndWindows() {
        when(costLedger.findSince(Instant.parse("2026-02-25T10:00:00Z"))).thenReturn(List.of());
        when(governor.summaries()).thenReturn(List.of());

        CostLedgerReport report = service.costLedger(7);

        assertThat(report.events()).isEmpty();
        assertThat(report.windows()).isEmpty();
    }

    @Test
    void leadsForUnknownJob() {
        when(orchestrator.find("missing")).thenThrow(new JobNotFoundException("missing"));

        assertThatThrownBy(() -> service.leadsForJob("missing")).isInstanceOf(JobNotFoundException.class);
        verify(businessRepository, never()).findLeadsForJob("missing");
    }

    @Test
    void estimateReportsSearchCostAndBudget() {
        when(pagedSearch.estimateCost(50)).thenReturn(new BigDecimal("0.00495"));
        when(governor.summaries()).thenReturn(List.of());

        Map<String, Object> estimate = service.estimate(50);

        assertThat(estimate)
                .containsEntry("max_results", 50)
                .containsEntry("estimated_search_cost", new BigDecimal("0.00495"))
                .containsKey("budget_windows");
    }
}
