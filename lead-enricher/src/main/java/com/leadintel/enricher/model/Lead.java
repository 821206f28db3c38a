package com.leadintel.enricher.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Output record: the business plus its current enrichment, flattened for exporters.
 */
public record Lead(
        String placeId,
        String name,
        String address,
        String phone,
        String website,
        Double rating,
        Integer reviewCount,
        List<String> categories,
        Double latitude,
        Double longitude,
        String hoursJson,
        List<String> emails,
        String contactName,
        Double confidence,
        String source,
        LocalDateTime enrichedAt,
        boolean enrichmentFailed) {

    public static Lead of(BusinessRecord b, EnrichmentResult r) {
        EmailCandidate primary = r == null ? null : r.primary();
        return new Lead(
                b.getPlaceId(), b.getName(), b.getAddress(), b.getPhone(), b.getWebsite(),
                b.getRating(), b.getReviewCount(), b.getCategories(),
                b.getLatitude(), b.getLongitude(), b.getHoursJson(),
                r == null ? List.of() : r.emails().stream().map(EmailCandidate::email).toList(),
                r == null ? null : r.contactName(),
                primary == null ? null : primary.confidence(),
                primary == null ? null : primary.source(),
                r == null ? null : r.enrichedAt(),
                r != null && r.enrichmentFailed());
    }
}
