package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HunterEmailFinderStrategyTest {

    private static final BusinessRecord ACME = BusinessRecord.builder()
            .placeId("p-acme").name("Acme Plumbing").website("https://www.acme.com").build();

    private MockRestServiceServer server;
    private LeadEnricherProperties properties;
    private HunterEmailFinderStrategy strategy;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new LeadEnricherProperties();
        properties.getEnrichment().getHunter().setEnabled(true);
        properties.getEnrichment().getHunter().setApiKey("hunter-key");
        strategy = new HunterEmailFinderStrategy(restTemplate, new EmailConfidenceScorer(), properties);
    }

    @Test
    @DisplayName("bills per returned email and keeps the first contact name")
    void domainSearch() {
        server.expect(requestTo(allOf(containsString("domain=acme.com"), containsString("api_key=hunter-key"))))
                .andRespond(withSuccess("""
                        {"data": {"domain": "acme.com", "emails": [
                          {"value": "jane@acme.com", "first_name": "Jane", "last_name": "Doe"},
                          {"value": "bob@acme.com", "first_name": null, "last_name": null}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        StrategyOutcome outcome = strategy.attempt(ACME);

        server.verify();
        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.MATCH);
        assertThat(outcome.candidates()).extracting(EmailCandidate::email).containsExactly("jane@acme.com", "bob@acme.com");
        assertThat(outcome.candidates()).allSatisfy(c -> assertThat(c.confidence()).isEqualTo(1.0));
        assertThat(outcome.contactName()).isEqualTo("Jane Doe");
        assertThat(outcome.cost()).isEqualByComparingTo("0.098");
    }

    @Test
    void estimateCoversTheMaximumEmails() {
        assertThat(strategy.billable()).isTrue();
        assertThat(strategy.provider()).isEqualTo("hunter_io");
        assertThat(strategy.estimatedCost(ACME)).isEqualByComparingTo("0.147");
    }

    @Test
    void emptyAnswerIsABilledNoMatch() {
        server.expect(requestTo(containsString("domain=acme.com")))
                .andRespond(withSuccess("{\"data\": {\"emails\": []}}", MediaType.APPLICATION_JSON));

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.NO_MATCH);
        assertThat(outcome.cost()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("an HTTP refusal completed the call: error with zero cost")
    void httpErrorIsSettled() {
        server.expect(requestTo(containsString("domain=acme.com"))).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.ERROR);
        assertThat(outcome.error()).contains("429");
        assertThat(outcome.cost()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("no answer at all: error with no cost, so the grant is released")
    void connectionFailureIsReleased() {
        server.expect(requestTo(containsString("domain=acme.com")))
                .andRespond(withException(new ConnectException("connection refused")));

        StrategyOutcome outcome = strategy.attempt(ACME);

        assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.ERROR);
        assertThat(outcome.cost()).isNull();
    }

    @Test
    void disabledOrKeylessIsUnsupported() {
        assertThat(strategy.supports(ACME)).isTrue();

        properties.getEnrichment().getHunter().setApiKey(" ");
        assertThat(strategy.supports(ACME)).isFalse();

        properties.getEnrichment().getHunter().setApiKey("hunter-key");
        properties.getEnrichment().getHunter().setEnabled(false);
        assertThat(strategy.supports(ACME)).isFalse();
    }
}
