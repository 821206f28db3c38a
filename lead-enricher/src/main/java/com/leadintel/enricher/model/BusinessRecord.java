package com.leadintel.enricher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Normalised business listing ready for dedup, enrichment and storage.
 *
 * Schema design notes:
 *  - placeId is the provider-assigned identity and the dedup key
 *  - website drives the enrichment cache key (domain) when present
 *  - hours is kept as the raw JSON payload, we never interpret it
 *  - sourceSearch is the job id that first imported the record
 */
@Value
@Builder(toBuilder = true)
public class BusinessRecord {

    // ── Identity ─────────────────────────────────────────────────────────────
    /** Stable place id from the maps provider (or a derived "gen:" hash when absent) */
    String placeId;

    // ── Listing ──────────────────────────────────────────────────────────────
    String name;
    String address;

    /** Cleaned phone number, US numbers formatted as (512) 555-0100 */
    String phone;

    String website;

    Double latitude;
    Double longitude;

    Double rating;
    Integer reviewCount;

    @Singular
    List<String> categories;

    /** Raw opening hours payload as returned by the provider */
    String hoursJson;

    // ── Metadata ─────────────────────────────────────────────────────────────
    String sourceSearch;

    LocalDateTime firstSeenAt;

    public boolean hasWebsite() {
        return website != null && !website.isBlank();
    }
}
