package com.leadintel.enricher.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.MapsPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin client over the ScrapingDog Google Maps API.
 *
 * Pagination: ~20 results per page, addressed by a zero-based "page" parameter.
 * Pages beyond the first only work with "ll" coordinates, so without them we stop
 * after page 0. The page token handed back to callers is the next page index.
 *
 * Rate limiting: the plan allows 10 req/s, we keep a minimum interval between calls.
 * 429 and 5xx surface as TransientProviderException for the searchProvider retry.
 */
@Service
@Slf4j
public class ScrapingDogClient implements SearchProvider {

    private static final List<String> RESULT_KEYS = List.of(
            "results", "data", "search_results", "places", "listings",
            "businesses", "local_results", "organic_results");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LeadEnricherProperties.Search config;

    private long lastRequestNanos;

    public ScrapingDogClient(RestTemplate restTemplate, ObjectMapper objectMapper, LeadEnricherProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getSearch();
    }

    @Override
    public SearchPage fetchPage(SearchQuery query, String pageToken) {
        int page = pageToken == null ? 0 : Integer.parseInt(pageToken);

        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(config.getBaseUrl())
                .queryParam("api_key", config.getApiKey())
                .queryParam("query", query.query())
                .queryParam("page", page);
        if (query.hasCoordinates()) {
            uri.queryParam("ll", query.coordinates());
        } else if (query.location() != null) {
            uri.queryParam("location", query.location());
        }
        URI url = uri.encode().build().toUri();

        log.debug("Fetching ScrapingDog page {} for '{}' in '{}'", page, query.query(), query.location());
        JsonNode body = call(url, page);
        List<MapsPlace> places = parsePlaces(body);
        log.info("Page {}: got {} results for '{}'", page, places.size(), query.query());

        String next = null;
        if (places.size() >= config.getPageSize() && query.hasCoordinates() && page + 1 < config.getMaxPages()) {
            next = String.valueOf(page + 1);
        }
        return new SearchPage(places, next);
    }

    @Override
    public String provider() {
        return config.getProvider();
    }

    @Override
    public String endpoint() {
        return config.getEndpoint();
    }

    @Override
    public BigDecimal costPerRequest() {
        return config.getCostPerRequest();
    }

    @Override
    public int pageSize() {
        return config.getPageSize();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode call(URI url, int page) {
        try {
            applyRateLimit();
            return restTemplate.getForObject(url, JsonNode.class);

        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            throw new ProviderAuthException("ScrapingDog rejected the API key (HTTP " + e.getStatusCode().value() + ")", e);

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by ScrapingDog on page {}", page);
            throw new TransientProviderException("ScrapingDog rate limit on page " + page, e);

        } catch (HttpClientErrorException e) {
            // other 4xx: the request itself is bad, retrying will not help
            log.warn("ScrapingDog returned HTTP {} for page {}, treating as empty: {}",
                    e.getStatusCode().value(), page, e.getResponseBodyAsString());
            return null;

        } catch (HttpServerErrorException e) {
            throw new TransientProviderException("ScrapingDog HTTP " + e.getStatusCode().value() + " on page " + page, e);

        } catch (ResourceAccessException e) {
            throw new TransientProviderException("ScrapingDog unreachable on page " + page + ": " + e.getMessage(), e);
        }
    }

    /**
     * The response shape varies: a root array, or an object holding the list under one of
     * several keys. Elements that are not objects or fail to bind are dropped.
     */
    List<MapsPlace> parsePlaces(JsonNode body) {
        if (body == null || body.isNull()) return List.of();

        JsonNode list = body.isArray() ? body : null;
        if (list == null) {
            for (String key : RESULT_KEYS) {
                JsonNode candidate = body.get(key);
                if (candidate != null && candidate.isArray()) {
                    list = candidate;
                    break;
                }
            }
        }
        if (list == null) {
            log.warn("No result list in ScrapingDog response, keys: {}", fieldNames(body));
            return List.of();
        }

        List<MapsPlace> places = new ArrayList<>();
        for (JsonNode item : list) {
            if (!item.isObject()) continue;
            try {
                places.add(objectMapper.treeToValue(item, MapsPlace.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable result: {}", e.getOriginalMessage());
            }
        }
        return places;
    }

    private List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private synchronized void applyRateLimit() {
        long minIntervalNanos = 1_000_000_000L / Math.max(1, config.getRequestsPerSecond());
        long wait = lastRequestNanos + minIntervalNanos - System.nanoTime();
        if (lastRequestNanos != 0 && wait > 0) {
            sleepNanos(wait);
        }
        lastRequestNanos = System.nanoTime();
    }

    private void sleepNanos(long nanos) {
        try {
            Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
