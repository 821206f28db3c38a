package com.leadintel.enricher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.MapsPlace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw ScrapingDog results to the normalised BusinessRecord domain model.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BusinessRecordMapper {

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d[\\d,]*)");

    private final Clock clock;

    /**
     * Convert a raw result to a BusinessRecord.
     *
     * @param raw           Raw DTO from the search provider
     * @param sourceSearch  Job id that imported the record (for lineage tracking)
     * @throws RecordValidationException when the result has no business name
     */
    public BusinessRecord map(MapsPlace raw, String sourceSearch) {
        String name = emptyToNull(raw.getTitle());
        if (name == null) {
            throw new RecordValidationException("result has no business name (place id " + raw.getPlaceId() + ")");
        }
        String address = emptyToNull(raw.getAddress());

        String placeId = emptyToNull(raw.getPlaceId());
        if (placeId == null) {
            placeId = derivedPlaceId(name, address);
            log.debug("No place id for '{}', derived {}", name, placeId);
        }

        Double[] latLng = parseGps(raw.getGps());

        return BusinessRecord.builder()
                .placeId(placeId)
                .name(name.trim())
                .address(address)
                .phone(cleanPhone(raw.getPhone()))
                .website(emptyToNull(raw.getWebsite()))
                .latitude(latLng[0])
                .longitude(latLng[1])
                .rating(parseDouble(raw.getRating()))
                .reviewCount(parseReviewCount(raw.getReviews()))
                .categories(parseCategories(raw.getType()))
                .hoursJson(raw.getHours() == null || raw.getHours().isNull() ? null : raw.getHours().toString())
                .sourceSearch(sourceSearch)
                .firstSeenAt(LocalDateTime.now(clock))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * US numbers: 10 digits → "(512) 555-0100", 11 digits with leading 1 → "+1 (512) 555-0100".
     * Anything else is returned as given.
     */
    static String cleanPhone(String phone) {
        if (phone == null || phone.isBlank()) return null;
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return phone.trim();
    }

    /** gps is either {"latitude":..,"longitude":..} (or lat/lng) or a "lat,lng" string. */
    private Double[] parseGps(JsonNode gps) {
        Double[] none = {null, null};
        if (gps == null || gps.isNull()) return none;

        if (gps.isTextual()) {
            String[] parts = gps.asText().split(",");
            if (parts.length != 2) return none;
            Double lat = parseDouble(parts[0]);
            Double lng = parseDouble(parts[1]);
            return lat == null || lng == null ? none : new Double[]{lat, lng};
        }
        if (gps.isObject()) {
            JsonNode lat = gps.has("latitude") ? gps.get("latitude") : gps.get("lat");
            JsonNode lng = gps.has("longitude") ? gps.get("longitude") : gps.get("lng");
            return new Double[]{parseDouble(lat), parseDouble(lng)};
        }
        return none;
    }

    private Double parseDouble(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        return parseDouble(node.asText());
    }

    private Double parseDouble(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts 123, "123" or "1,234 reviews". */
    private Integer parseReviewCount(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asInt();
        Matcher m = FIRST_NUMBER.matcher(node.asText());
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private List<String> parseCategories(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        Set<String> categories = new LinkedHashSet<>();
        if (node.isArray()) {
            node.forEach(c -> {
                if (c.isTextual() && !c.asText().isBlank()) categories.add(c.asText().trim());
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            categories.add(node.asText().trim());
        }
        return List.copyOf(categories);
    }

    private String derivedPlaceId(String name, String address) {
        String key = name.trim().toLowerCase() + "|" + (address == null ? "" : address.trim().toLowerCase());
        return "gen:" + DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
