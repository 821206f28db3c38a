package com.leadintel.enricher.model;

/**
 * One search to run: a single API request or one row of a batch CSV.
 */
public record SearchRequest(String query, String location, int maxResults) {

    public static final int DEFAULT_MAX_RESULTS = 100;

    public SearchRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("max_results must be positive, was " + maxResults);
        }
        query = query.trim();
        location = location == null || location.isBlank() ? null : location.trim();
    }
}
