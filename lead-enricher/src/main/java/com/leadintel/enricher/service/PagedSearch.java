package com.leadintel.enricher.service;

import com.leadintel.enricher.budget.Authorization;
import com.leadintel.enricher.budget.BudgetExhaustedException;
import com.leadintel.enricher.budget.CostGovernor;
import com.leadintel.enricher.budget.Grant;
import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.MapsPlace;
import com.leadintel.enricher.model.SearchRequest;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Budget-gated pagination over a SearchProvider.
 *
 * Every page goes through the same sequence: authorize with the CostGovernor, fetch under
 * the searchProvider retry policy, then record the cost (completed call) or release the
 * grant (the call never completed). Pages are fetched lazily, one at a time.
 */
@Service
@Slf4j
public class PagedSearch {

    public enum StopReason { NOT_STOPPED, MAX_RESULTS, EXHAUSTED, BUDGET_DENIED, PROVIDER_ERROR }

    private final SearchProvider provider;
    private final CostGovernor governor;
    private final Retry retry;
    private final GeocodingService geocoding;
    private final LeadEnricherProperties properties;

    public PagedSearch(SearchProvider provider, CostGovernor governor, Retry searchProviderRetry,
                       GeocodingService geocoding, LeadEnricherProperties properties) {
        this.provider = provider;
        this.governor = governor;
        this.retry = searchProviderRetry;
        this.geocoding = geocoding;
        this.properties = properties;
    }

    /** Geocodes the location once so every page of the search uses the same coordinates. */
    public SearchQuery prepare(SearchRequest request) {
        String ll = geocoding.lookup(request.location())
                .map(c -> c.toLl(properties.getGeocoding().getZoom()))
                .orElse(null);
        if (request.location() != null && ll == null) {
            log.warn("No coordinates for '{}', only the first page can be fetched", request.location());
        }
        return new SearchQuery(request.query(), request.location(), ll);
    }

    /**
     * Lazily pages through results until maxResults are delivered, the provider runs out,
     * the page cap is hit, budget is denied or a page fails after retries.
     *
     * @param fromToken checkpointed page token to resume from, null to start at the first page
     */
    public Cursor pages(SearchQuery query, int maxResults, String fromToken) {
        return new Cursor(query, maxResults, fromToken);
    }

    /** Collects every page of a search into one list. */
    public List<MapsPlace> search(SearchRequest request) {
        List<MapsPlace> all = new ArrayList<>();
        pages(prepare(request), request.maxResults(), null).forEachRemaining(p -> all.addAll(p.places()));
        log.info("Search completed: {} results for '{}'", all.size(), request.query());
        return all;
    }

    /** Worst-case provider spend for a search of this size. */
    public BigDecimal estimateCost(int maxResults) {
        int pageSize = Math.max(1, provider.pageSize());
        int pages = Math.min((maxResults + pageSize - 1) / pageSize, properties.getSearch().getMaxPages());
        return provider.costPerRequest().multiply(BigDecimal.valueOf(pages));
    }

    public class Cursor implements Iterator<SearchPage> {

        private final SearchQuery query;
        private final int maxResults;
        private String token;
        private int delivered;
        private SearchPage buffered;
        private StopReason stopReason = StopReason.NOT_STOPPED;

        private Cursor(SearchQuery query, int maxResults, String fromToken) {
            this.query = query;
            this.maxResults = maxResults;
            this.token = fromToken;
            if (maxResults <= 0) stopReason = StopReason.MAX_RESULTS;
        }

        @Override
        public boolean hasNext() {
            if (buffered == null && stopReason == StopReason.NOT_STOPPED) {
                buffered = fetchNext();
            }
            return buffered != null;
        }

        @Override
        public SearchPage next() {
            if (!hasNext()) throw new NoSuchElementException();
            SearchPage page = buffered;
            buffered = null;
            return page;
        }

        public StopReason getStopReason() {
            return stopReason;
        }

        private SearchPage fetchNext() {
            Authorization auth = governor.authorize(provider.provider(), provider.endpoint(), provider.costPerRequest());
            if (!auth.isGranted()) {
                if (properties.getBudget().isStrict()) {
                    throw new BudgetExhaustedException("Search budget exhausted (" + auth.deniedBy() + ")");
                }
                log.warn("Search budget denied by {} after {} results for '{}', stopping",
                        auth.deniedBy(), delivered, query.query());
                stopReason = StopReason.BUDGET_DENIED;
                return null;
            }

            Grant grant = auth.grant();
            SearchPage page;
            try {
                page = Retry.decorateSupplier(retry, () -> provider.fetchPage(query, token)).get();
            } catch (TransientProviderException e) {
                governor.release(grant);
                log.warn("Page {} for '{}' failed after retries, stopping: {}", token, query.query(), e.getMessage());
                stopReason = StopReason.PROVIDER_ERROR;
                return null;
            } catch (RuntimeException e) {
                governor.release(grant);
                throw e;
            }
            governor.record(grant, provider.costPerRequest());

            if (page.places().isEmpty()) {
                stopReason = StopReason.EXHAUSTED;
                return null;
            }

            List<MapsPlace> places = page.places();
            int remaining = maxResults - delivered;
            if (places.size() >= remaining) {
                places = places.subList(0, remaining);
                stopReason = StopReason.MAX_RESULTS;
            } else if (!page.hasMore()) {
                stopReason = StopReason.EXHAUSTED;
            }
            delivered += places.size();
            token = page.nextPageToken();
            return new SearchPage(places, stopReason == StopReason.NOT_STOPPED ? token : null);
        }
    }
}
