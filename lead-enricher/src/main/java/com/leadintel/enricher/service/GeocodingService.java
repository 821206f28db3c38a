package com.leadintel.enricher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadintel.enricher.config.LeadEnricherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a free-text location to lat/lng so the search provider can paginate.
 * Major US cities come from a built-in table; anything else goes to Nominatim (OpenStreetMap).
 *
 * Example: "Austin, TX" → {lat: 30.2672, lng: -97.7431}
 */
@Service
@Slf4j
public class GeocodingService {

    private static final Map<String, Coordinates> KNOWN_CITIES = Map.ofEntries(
            Map.entry("san francisco", new Coordinates(37.7749, -122.4194)),
            Map.entry("san francisco, ca", new Coordinates(37.7749, -122.4194)),
            Map.entry("san francisco, california", new Coordinates(37.7749, -122.4194)),
            Map.entry("new york", new Coordinates(40.7128, -74.0060)),
            Map.entry("new york, ny", new Coordinates(40.7128, -74.0060)),
            Map.entry("new york city", new Coordinates(40.7128, -74.0060)),
            Map.entry("los angeles", new Coordinates(34.0522, -118.2437)),
            Map.entry("los angeles, ca", new Coordinates(34.0522, -118.2437)),
            Map.entry("chicago", new Coordinates(41.8781, -87.6298)),
            Map.entry("chicago, il", new Coordinates(41.8781, -87.6298)),
            Map.entry("houston", new Coordinates(29.7604, -95.3698)),
            Map.entry("houston, tx", new Coordinates(29.7604, -95.3698)),
            Map.entry("phoenix", new Coordinates(33.4484, -112.0740)),
            Map.entry("phoenix, az", new Coordinates(33.4484, -112.0740)),
            Map.entry("philadelphia", new Coordinates(39.9526, -75.1652)),
            Map.entry("philadelphia, pa", new Coordinates(39.9526, -75.1652)),
            Map.entry("miami", new Coordinates(25.7617, -80.1918)),
            Map.entry("miami, fl", new Coordinates(25.7617, -80.1918)),
            Map.entry("denver", new Coordinates(39.7392, -104.9903)),
            Map.entry("denver, co", new Coordinates(39.7392, -104.9903)),
            Map.entry("seattle", new Coordinates(47.6062, -122.3321)),
            Map.entry("seattle, wa", new Coordinates(47.6062, -122.3321)),
            Map.entry("austin", new Coordinates(30.2672, -97.7431)),
            Map.entry("austin, tx", new Coordinates(30.2672, -97.7431)),
            Map.entry("dallas", new Coordinates(32.7767, -96.7970)),
            Map.entry("dallas, tx", new Coordinates(32.7767, -96.7970)),
            Map.entry("san diego", new Coordinates(32.7157, -117.1611)),
            Map.entry("san diego, ca", new Coordinates(32.7157, -117.1611)),
            Map.entry("san jose", new Coordinates(37.3382, -121.8863)),
            Map.entry("san jose, ca", new Coordinates(37.3382, -121.8863)));

    private final ObjectMapper objectMapper;
    private final LeadEnricherProperties.Geocoding config;
    private final HttpClient httpClient;

    public record Coordinates(double latitude, double longitude) {

        /** ScrapingDog "ll" parameter, e.g. "@30.2672,-97.7431,12z" */
        public String toLl(int zoom) {
            return String.format(Locale.ROOT, "@%.4f,%.4f,%dz", latitude, longitude, zoom);
        }
    }

    public GeocodingService(ObjectMapper objectMapper, LeadEnricherProperties properties) {
        this.objectMapper = objectMapper;
        this.config = properties.getGeocoding();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build();
    }

    /**
     * @return coordinates, or empty when the location is blank or cannot be resolved
     */
    public Optional<Coordinates> lookup(String location) {
        if (location == null || location.isBlank()) return Optional.empty();

        Coordinates known = KNOWN_CITIES.get(location.trim().toLowerCase(Locale.ROOT));
        if (known != null) {
            log.debug("Location '{}' resolved from city table → {}", location, known);
            return Optional.of(known);
        }
        if (!config.isEnabled()) return Optional.empty();

        String url = config.getBaseUrl() + "?format=json&limit=1&q="
                + URLEncoder.encode(location.trim(), StandardCharsets.UTF_8);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Nominatim returned HTTP {} for '{}'", response.statusCode(), location);
                return Optional.empty();
            }

            JsonNode root = objectMapper.readTree(response.body());
            if (!root.isArray() || root.isEmpty()) {
                log.warn("Could not geocode '{}', falling back to text search", location);
                return Optional.empty();
            }
            JsonNode first = root.get(0);
            Coordinates coords = new Coordinates(first.get("lat").asDouble(), first.get("lon").asDouble());
            log.debug("Location '{}' → {}", location, coords);
            return Optional.of(coords);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Geocoding failed for '{}': {}", location, e.getMessage());
            return Optional.empty();
        }
    }
}
