package com.leadintel.enricher.budget;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.config.LeadEnricherProperties.Budget.ScopeLimits;
import com.leadintel.enricher.config.LeadEnricherProperties.Budget.WindowLimit;
import com.leadintel.enricher.model.BudgetWindowSummary;
import com.leadintel.enricher.model.CostEvent;
import com.leadintel.enricher.model.WindowKind;
import com.leadintel.enricher.store.CostLedgerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gate for every billable call.
 *
 * Owns the cost ledger and the day/week/month windows for each provider plus the
 * all-providers total. All state changes happen under one lock, so two workers can
 * never both be granted the last slice of a window: authorize() reserves the estimate
 * and record()/release() settle the reservation.
 *
 * Windows are rebuilt from the ledger the first time they are touched and roll over
 * lazily when a call lands past the window boundary.
 */
@Component
@Slf4j
public class CostGovernor {

    public static final String TOTAL_SCOPE = "*";

    private final CostLedgerRepository ledger;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, ScopeLimits> providerLimits;
    private final ScopeLimits totalLimits;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BudgetWindow> windows = new HashMap<>();
    private final Map<Long, Grant> outstanding = new HashMap<>();
    private long grantSequence;

    public CostGovernor(CostLedgerRepository ledger, LeadEnricherProperties properties, Clock clock) {
        this.ledger = ledger;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getBudget().getZone());
        this.providerLimits = properties.getBudget().getProviders();
        this.totalLimits = properties.getBudget().getTotal();
    }

    /**
     * Pre-call check. Denied if adding the estimate (and one request) to any configured
     * window of the provider or of the total would exceed its limit.
     */
    public Authorization authorize(String provider, String endpoint, BigDecimal estimatedCost) {
        BigDecimal estimate = nonNegative(estimatedCost);
        lock.lock();
        try {
            Instant now = clock.instant();
            for (String scope : scopesOf(provider)) {
                for (WindowKind kind : WindowKind.values()) {
                    WindowLimit limit = limitFor(scope, kind);
                    if (limit == null) continue;

                    BudgetWindow w = window(scope, kind, now);
                    if (limit.getMaxCost() != null
                            && w.committedCost().add(estimate).compareTo(limit.getMaxCost()) > 0) {
                        BigDecimal remaining = limit.getMaxCost().subtract(w.committedCost()).max(BigDecimal.ZERO);
                        log.info("Budget denied {}/{}: {} window {} would exceed cost cap {} (remaining {})",
                                provider, endpoint, scope, kind, limit.getMaxCost(), remaining);
                        return Authorization.denied(scope + "/" + kind, remaining);
                    }
                    if (limit.getMaxRequests() != null && w.committedRequests() + 1 > limit.getMaxRequests()) {
                        log.info("Budget denied {}/{}: {} window {} at request cap {}",
                                provider, endpoint, scope, kind, limit.getMaxRequests());
                        return Authorization.denied(scope + "/" + kind, remainingCost(limit, w));
                    }
                }
            }

            Grant grant = new Grant(++grantSequence, provider, endpoint, estimate, now);
            for (String scope : scopesOf(provider)) {
                for (WindowKind kind : WindowKind.values()) {
                    window(scope, kind, now).reserve(estimate);
                }
            }
            outstanding.put(grant.id(), grant);
            log.debug("Budget granted #{} {}/{} estimate {}", grant.id(), provider, endpoint, estimate);
            return Authorization.granted(grant);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a completed billable call: appends the ledger event and moves the grant's
     * reservation into the window counters. Called once per completed call, whether or not
     * the call produced anything useful.
     */
    public CostEvent record(Grant grant, BigDecimal actualCost) {
        return record(grant, actualCost, true, null);
    }

    public CostEvent record(Grant grant, BigDecimal actualCost, boolean success, String errorMessage) {
        BigDecimal cost = nonNegative(actualCost);
        lock.lock();
        try {
            settle(grant);
            Instant now = clock.instant();
            CostEvent event;
            try {
                event = ledger.append(new CostEvent(null, grant.provider(), grant.endpoint(), cost, now,
                        success, errorMessage));
            } catch (RuntimeException e) {
                unreserve(grant, now);
                throw e;
            }
            for (String scope : scopesOf(grant.provider())) {
                for (WindowKind kind : WindowKind.values()) {
                    BudgetWindow w = window(scope, kind, now);
                    w.unreserve(grant.estimatedCost());
                    w.add(cost);
                }
            }
            log.debug("Recorded {} {}/{} cost {}", grant.id(), grant.provider(), grant.endpoint(), cost);
            return event;
        } finally {
            lock.unlock();
        }
    }

    /** Returns a reservation for a call that never completed (timeout, connection failure). */
    public void release(Grant grant) {
        lock.lock();
        try {
            settle(grant);
            unreserve(grant, clock.instant());
            log.debug("Released grant #{} {}/{}", grant.id(), grant.provider(), grant.endpoint());
        } finally {
            lock.unlock();
        }
    }

    public List<BudgetWindowSummary> summaries() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Set<String> scopes = new LinkedHashSet<>(providerLimits.keySet());
            windows.values().forEach(w -> scopes.add(w.getScope()));
            scopes.remove(TOTAL_SCOPE);

            List<BudgetWindowSummary> result = new ArrayList<>();
            for (String scope : scopes) {
                for (WindowKind kind : WindowKind.values()) {
                    result.add(summarise(window(scope, kind, now), limitFor(scope, kind)));
                }
            }
            for (WindowKind kind : WindowKind.values()) {
                result.add(summarise(window(TOTAL_SCOPE, kind, now), limitFor(TOTAL_SCOPE, kind)));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public ZoneId zone() {
        return zone;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void settle(Grant grant) {
        if (outstanding.remove(grant.id()) == null) {
            throw new IllegalStateException("Grant #" + grant.id() + " was already settled");
        }
    }

    private void unreserve(Grant grant, Instant now) {
        for (String scope : scopesOf(grant.provider())) {
            for (WindowKind kind : WindowKind.values()) {
                window(scope, kind, now).unreserve(grant.estimatedCost());
            }
        }
    }

    private BudgetWindow window(String scope, WindowKind kind, Instant now) {
        Instant start = kind.startOf(now, zone);
        String key = scope + "|" + kind;
        BudgetWindow w = windows.get(key);
        if (w == null) {
            CostLedgerRepository.Totals totals = ledger.totalsSince(TOTAL_SCOPE.equals(scope) ? null : scope, start);
            w = new BudgetWindow(kind, scope, start, totals.requests(), totals.cost());
            windows.put(key, w);
        } else if (w.getWindowStart().isBefore(start)) {
            log.info("Budget window {} {} rolled over to {}", scope, kind, start);
            w.rollTo(start);
        }
        return w;
    }

    private List<String> scopesOf(String provider) {
        return List.of(provider, TOTAL_SCOPE);
    }

    private WindowLimit limitFor(String scope, WindowKind kind) {
        ScopeLimits limits = TOTAL_SCOPE.equals(scope) ? totalLimits : providerLimits.get(scope);
        return limits == null ? null : limits.forKind(kind);
    }

    private BudgetWindowSummary summarise(BudgetWindow w, WindowLimit limit) {
        BigDecimal costLimit = limit == null ? null : limit.getMaxCost();
        Long requestLimit = limit == null ? null : limit.getMaxRequests();
        return new BudgetWindowSummary(
                w.getKind(), w.getScope(), w.getWindowStart(),
                w.getRequestCount(), w.getCumulativeCost(),
                costLimit,
                costLimit == null ? null : costLimit.subtract(w.getCumulativeCost()).max(BigDecimal.ZERO),
                requestLimit,
                requestLimit == null ? null : Math.max(0, requestLimit - w.getRequestCount()));
    }

    private BigDecimal remainingCost(WindowLimit limit, BudgetWindow w) {
        return limit.getMaxCost() == null ? null : limit.getMaxCost().subtract(w.committedCost()).max(BigDecimal.ZERO);
    }

    private BigDecimal nonNegative(BigDecimal value) {
        if (value == null) return BigDecimal.ZERO;
        if (value.signum() < 0) {
            throw new IllegalArgumentException("cost must be >= 0, was " + value);
        }
        return value;
    }
}
