package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebsiteScrapeStrategyTest {

    private static final BusinessRecord ACME = BusinessRecord.builder()
            .placeId("p-acme").name("Acme Plumbing").website("acme.com").build();

    private final Map<String, String> site = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private WebsiteScrapeStrategy strategy;

    @BeforeEach
    void setUp() {
        PageFetcher fetcher = url -> {
            fetched.add(url);
            String html = site.get(url);
            if (html == null) throw new IOException("HTTP 404 " + url);
            return Jsoup.parse(html, url);
        };
        strategy = new WebsiteScrapeStrategy(fetcher, new EmailConfidenceScorer(), new LeadEnricherProperties());
    }

    @Test
    @DisplayName("home page addresses are scored and sorted, contact pages are not needed")
    void homePage() {
        site.put("https://acme.com", """
                <html><body>
                  <p>Questions? acmeplumbing@gmail.com</p>
                  <a href="mailto:info@acme.com?subject=Quote">Email us</a>
                  <p>Owner: Jane Doe</p>
                </body></html>
                """);

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.MATCH);
        assertThat(outcome.candidates()).extracting(EmailCandidate::email)
                .containsExactly("info@acme.com", "acmeplumbing@gmail.com");
        assertThat(outcome.candidates().get(0).confidence()).isEqualTo(1.0);
        assertThat(outcome.candidates().get(1).confidence()).isEqualTo(0.7);
        assertThat(outcome.contactName()).isEqualTo("Jane Doe");
        assertThat(fetched).containsExactly("https://acme.com");
    }

    @Test
    void fallsBackToContactPages() {
        site.put("https://acme.com", "<html><body><h1>Acme</h1></body></html>");
        site.put("https://acme.com/contact-us", """
                <html><body><div class="contact-name">John Smith</div>
                <p>Reach us at hello at acme dot com</p></body></html>
                """);

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.candidates()).extracting(EmailCandidate::email).containsExactly("hello@acme.com");
        assertThat(outcome.contactName()).isEqualTo("John Smith");
        assertThat(fetched).containsExactly("https://acme.com", "https://acme.com/contact", "https://acme.com/contact-us");
    }

    @Test
    void noAddressesIsNoMatch() {
        site.put("https://acme.com", "<html><body>Call 512-555-0100</body></html>");

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.NO_MATCH);
        // home page plus the first three contact paths
        assertThat(fetched).hasSize(4);
    }

    @Test
    @DisplayName("an unreachable site is a free failed attempt")
    void unreachableSite() {
        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.ERROR);
        assertThat(outcome.error()).contains("unreachable");
        assertThat(outcome.cost()).isEqualByComparingTo("0");
    }

    @Test
    void placeholderAddressesAreIgnored() {
        Document doc = Jsoup.parse("<p>you@example.com or logo@2x.png</p><a href='mailto:team@acme.com'>x</a>");

        assertThat(WebsiteScrapeStrategy.emailsIn(doc)).containsExactly("team@acme.com");
    }

    @Test
    void onlyBusinessesWithAWebsiteAreSupported() {
        assertThat(strategy.supports(ACME)).isTrue();
        assertThat(strategy.supports(ACME.toBuilder().website(" ").build())).isFalse();
    }
}
