package com.leadintel.enricher.service;

import java.math.BigDecimal;

/**
 * A paid maps-search backend. Each fetchPage call is one billable request; callers
 * must authorize it with the CostGovernor first.
 */
public interface SearchProvider {

    /**
     * @param pageToken null for the first page, otherwise the token of the previous page
     * @throws TransientProviderException on timeouts, 429 and 5xx
     * @throws ProviderAuthException      on 401/403
     */
    SearchPage fetchPage(SearchQuery query, String pageToken);

    /** Provider name used as the budget scope, e.g. "scrapingdog". */
    String provider();

    String endpoint();

    BigDecimal costPerRequest();

    int pageSize();
}
