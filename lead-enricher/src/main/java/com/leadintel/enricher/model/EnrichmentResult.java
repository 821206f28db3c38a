package com.leadintel.enricher.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of enriching one business. At most one current result exists per placeId.
 *
 * An empty email list always comes with enrichmentFailed = true; that is a
 * valid outcome, the business is still exported.
 */
public record EnrichmentResult(
        String placeId,
        List<EmailCandidate> emails,
        String contactName,
        LocalDateTime enrichedAt,
        boolean enrichmentFailed,
        List<String> strategiesTried) {

    public static final int MAX_EMAILS = 3;

    public EnrichmentResult {
        emails = emails == null ? List.of() : List.copyOf(emails);
        strategiesTried = strategiesTried == null ? List.of() : List.copyOf(strategiesTried);
        if (emails.size() > MAX_EMAILS) {
            throw new IllegalArgumentException("at most " + MAX_EMAILS + " emails per business, got " + emails.size());
        }
        if (emails.isEmpty() && !enrichmentFailed) {
            throw new IllegalArgumentException("a result without emails must be marked failed");
        }
    }

    public static EnrichmentResult found(String placeId, List<EmailCandidate> emails, String contactName,
                                         LocalDateTime enrichedAt, List<String> strategiesTried) {
        return new EnrichmentResult(placeId, emails, contactName, enrichedAt, false, strategiesTried);
    }

    public static EnrichmentResult failed(String placeId, LocalDateTime enrichedAt, List<String> strategiesTried) {
        return new EnrichmentResult(placeId, List.of(), null, enrichedAt, true, strategiesTried);
    }

    /** Same outcome re-attributed to another business sharing the cache key (same domain). */
    public EnrichmentResult forPlace(String otherPlaceId) {
        return new EnrichmentResult(otherPlaceId, emails, contactName, enrichedAt, enrichmentFailed, strategiesTried);
    }

    public EmailCandidate primary() {
        return emails.isEmpty() ? null : emails.get(0);
    }
}
