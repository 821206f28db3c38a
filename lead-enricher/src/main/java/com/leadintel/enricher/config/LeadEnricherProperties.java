package com.leadintel.enricher.config;

import com.leadintel.enricher.model.WindowKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "lead-enricher")
@Data
public class LeadEnricherProperties {

    private Search search = new Search();
    private Geocoding geocoding = new Geocoding();
    private Enrichment enrichment = new Enrichment();
    private Budget budget = new Budget();
    private Jobs jobs = new Jobs();

    @Data
    public static class Search {
        private String baseUrl = "https://api.scrapingdog.com/google_maps";
        private String apiKey;
        private String provider = "scrapingdog";
        private String endpoint = "google_maps_search";
        /** 5 credits per request at $0.00033 per credit */
        private BigDecimal costPerRequest = new BigDecimal("0.00165");
        private int pageSize = 20;
        private int maxPages = 6;
        private int requestsPerSecond = 10;
    }

    @Data
    public static class Geocoding {
        private boolean enabled = true;
        private String baseUrl = "https://nominatim.openstreetmap.org/search";
        private String userAgent = "lead-enricher/1.0";
        private int zoom = 12;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Enrichment {
        /** Strategy names in priority order */
        private List<String> strategies = new ArrayList<>(List.of("website-scrape", "hunter", "pattern-generation"));
        private double confidenceThreshold = 0.7;
        private int maxEmails = 3;
        private boolean stopAtFirstMatch = true;
        private int workerThreads = 4;
        private Duration defaultStrategyTimeout = Duration.ofSeconds(20);
        private Map<String, Duration> strategyTimeouts = new HashMap<>();
        private Duration cacheTtl = Duration.ofDays(30);
        private Duration negativeCacheTtl = Duration.ofDays(1);
        private Website website = new Website();
        private Hunter hunter = new Hunter();
        private Pattern pattern = new Pattern();

        public Duration timeoutFor(String strategy) {
            return strategyTimeouts.getOrDefault(strategy, defaultStrategyTimeout);
        }

        @Data
        public static class Website {
            private Duration timeout = Duration.ofSeconds(15);
            private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";
            private List<String> contactPaths = new ArrayList<>(List.of(
                    "/contact", "/contact-us", "/contact.html", "/about", "/about-us", "/team"));
            private int maxContactPages = 3;
            private double baseConfidence = 0.7;
        }

        @Data
        public static class Hunter {
            private boolean enabled = false;
            private String apiKey;
            private String baseUrl = "https://api.hunter.io/v2/domain-search";
            private String provider = "hunter_io";
            private String endpoint = "domain-search";
            private BigDecimal costPerRequest = BigDecimal.ZERO;
            private BigDecimal costPerEmail = new BigDecimal("0.049");
            private double baseConfidence = 0.9;
        }

        @Data
        public static class Pattern {
            private List<String> mailboxes = new ArrayList<>(List.of(
                    "info", "contact", "hello", "admin", "support", "sales", "office"));
            private double baseConfidence = 0.4;
        }
    }

    @Data
    public static class Budget {
        private String zone = "UTC";
        /** Strict mode fails a job when search budget runs out instead of completing with what it has */
        private boolean strict = false;
        private Map<String, ScopeLimits> providers = new LinkedHashMap<>();
        private ScopeLimits total = new ScopeLimits();

        @Data
        public static class ScopeLimits {
            private WindowLimit day;
            private WindowLimit week;
            private WindowLimit month;

            public WindowLimit forKind(WindowKind kind) {
                return switch (kind) {
                    case DAY -> day;
                    case WEEK -> week;
                    case MONTH -> month;
                };
            }
        }

        @Data
        public static class WindowLimit {
            private BigDecimal maxCost;     // null = no cost cap
            private Long maxRequests;       // null = no request cap
        }
    }

    @Data
    public static class Jobs {
        private int concurrency = 2;
        private boolean resumeOnStartup = true;
        private String cachePurgeCron = "0 30 3 * * ?";
    }
}
