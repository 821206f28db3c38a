package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.budget.Authorization;
import com.leadintel.enricher.budget.CostGovernor;
import com.leadintel.enricher.budget.Grant;
import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import com.leadintel.enricher.model.EnrichmentResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered fallback across enrichment strategies.
 *
 * For each business: cache first; then each strategy in configured order, authorizing billable
 * ones with the CostGovernor (denied → skip), running each attempt under its timeout and
 * accepting candidates at or above the confidence threshold. Never throws for a per-business
 * problem: when nothing is accepted the result is marked enrichmentFailed.
 */
@Service
@Slf4j
public class EnrichmentWaterfall {

    private final List<EnrichmentStrategy> strategies;
    private final EnrichmentCache cache;
    private final CostGovernor governor;
    private final ExecutorService callExecutor;
    private final LeadEnricherProperties.Enrichment config;
    private final Clock clock;

    /** Enrichments currently running per cache key, so concurrent businesses on one domain share a lookup */
    private final ConcurrentMap<String, CompletableFuture<EnrichmentResult>> inFlight = new ConcurrentHashMap<>();

    public EnrichmentWaterfall(List<EnrichmentStrategy> availableStrategies,
                               EnrichmentCache cache,
                               CostGovernor governor,
                               @Qualifier("strategyCallExecutor") ExecutorService callExecutor,
                               LeadEnricherProperties properties,
                               Clock clock) {
        this.config = properties.getEnrichment();
        this.strategies = select(availableStrategies, config.getStrategies());
        this.cache = cache;
        this.governor = governor;
        this.callExecutor = callExecutor;
        this.clock = clock;
        log.info("Enrichment waterfall: {}", strategyNames());
    }

    /** The named strategies in the given order. An unknown name is a configuration error. */
    static List<EnrichmentStrategy> select(List<EnrichmentStrategy> available, List<String> names) {
        Map<String, EnrichmentStrategy> byName = available.stream()
                .collect(Collectors.toMap(EnrichmentStrategy::name, Function.identity()));
        List<EnrichmentStrategy> ordered = new ArrayList<>();
        for (String name : names) {
            EnrichmentStrategy strategy = byName.get(name);
            if (strategy == null) {
                throw new IllegalStateException("Unknown enrichment strategy '" + name + "', available: "
                        + byName.keySet());
            }
            ordered.add(strategy);
        }
        return List.copyOf(ordered);
    }

    public EnrichmentResult enrich(BusinessRecord business) {
        String key = EnrichmentCache.keyFor(business);

        Optional<EnrichmentResult> cached = cache.lookup(key);
        if (cached.isPresent()) {
            log.debug("Cache hit {} for {}", key, business.getPlaceId());
            return cached.get().forPlace(business.getPlaceId());
        }

        CompletableFuture<EnrichmentResult> mine = new CompletableFuture<>();
        CompletableFuture<EnrichmentResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Waiting for in-flight enrichment of {} for {}", key, business.getPlaceId());
            try {
                return running.join().forPlace(business.getPlaceId());
            } catch (CompletionException | CancellationException e) {
                log.warn("In-flight enrichment of {} failed ({}), running strategies for {}",
                        key, e.getMessage(), business.getPlaceId());
                return runStrategies(business, key);
            }
        }

        try {
            // a worker may have finished this key between our lookup and registration
            EnrichmentResult result = cache.lookup(key)
                    .map(r -> r.forPlace(business.getPlaceId()))
                    .orElseGet(() -> runStrategies(business, key));
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public List<String> strategyNames() {
        return strategies.stream().map(EnrichmentStrategy::name).toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private EnrichmentResult runStrategies(BusinessRecord business, String key) {
        int maxEmails = Math.min(config.getMaxEmails(), EnrichmentResult.MAX_EMAILS);
        List<EmailCandidate> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<String> tried = new ArrayList<>();
        String contactName = null;

        for (EnrichmentStrategy strategy : strategies) {
            if (accepted.size() >= maxEmails) break;
            if (!strategy.supports(business)) {
                log.debug("Strategy {} does not apply to {}", strategy.name(), business.getPlaceId());
                continue;
            }

            Grant grant = null;
            if (strategy.billable()) {
                Authorization auth = governor.authorize(strategy.provider(), strategy.endpoint(),
                        strategy.estimatedCost(business));
                if (!auth.isGranted()) {
                    log.info("Skipping {} for {} ({}): budget denied by {}",
                            strategy.name(), business.getPlaceId(), business.getName(), auth.deniedBy());
                    continue;
                }
                grant = auth.grant();
            }

            tried.add(strategy.name());
            StrategyOutcome outcome = attempt(strategy, business);
            settle(grant, outcome);

            if (outcome.kind() == StrategyOutcome.Kind.ERROR) {
                log.warn("Strategy {} failed for {} ({}): {}",
                        strategy.name(), business.getPlaceId(), business.getName(), outcome.error());
                continue;
            }

            int before = accepted.size();
            for (EmailCandidate candidate : outcome.candidates()) {
                if (accepted.size() >= maxEmails) break;
                if (candidate.confidence() < config.getConfidenceThreshold()) {
                    log.debug("{} rejected {} for {}: confidence {} below {}", strategy.name(), candidate.email(),
                            business.getPlaceId(), candidate.confidence(), config.getConfidenceThreshold());
                    continue;
                }
                if (EmailExtractor.isValid(candidate.email()) && seen.add(candidate.email().toLowerCase())) {
                    accepted.add(candidate);
                }
            }

            if (accepted.size() > before) {
                if (contactName == null) contactName = outcome.contactName();
                log.debug("{} accepted {} email(s) for {}", strategy.name(), accepted.size() - before,
                        business.getPlaceId());
                if (config.isStopAtFirstMatch()) break;
            } else {
                log.debug("No acceptable match from {} for {}", strategy.name(), business.getPlaceId());
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        EnrichmentResult result;
        Duration ttl;
        if (accepted.isEmpty()) {
            log.info("No email found for {} ({}), tried {}", business.getPlaceId(), business.getName(), tried);
            result = EnrichmentResult.failed(business.getPlaceId(), now, tried);
            ttl = config.getNegativeCacheTtl();
        } else {
            result = EnrichmentResult.found(business.getPlaceId(), accepted, contactName, now, tried);
            ttl = config.getCacheTtl();
        }
        cache.store(key, result, ttl);
        return result;
    }

    private StrategyOutcome attempt(EnrichmentStrategy strategy, BusinessRecord business) {
        Duration timeout = config.timeoutFor(strategy.name());
        Future<StrategyOutcome> future = callExecutor.submit(() -> strategy.attempt(business));
        try {
            StrategyOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : StrategyOutcome.error("strategy returned no outcome", null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return StrategyOutcome.error("timed out after " + timeout.toMillis() + " ms", null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return StrategyOutcome.error(cause.getClass().getSimpleName() + ": " + cause.getMessage(), null);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StrategyOutcome.error("interrupted", null);
        }
    }

    private void settle(Grant grant, StrategyOutcome outcome) {
        if (grant == null) return;
        if (outcome.cost() == null) {
            governor.release(grant);
        } else {
            boolean success = outcome.kind() != StrategyOutcome.Kind.ERROR;
            governor.record(grant, outcome.cost(), success, outcome.error());
        }
    }
}
