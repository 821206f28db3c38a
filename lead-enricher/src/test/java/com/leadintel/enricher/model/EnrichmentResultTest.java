package com.leadintel.enricher.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentResultTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Test
    @DisplayName("accepts up to three emails")
    void threeEmailsAllowed() {
        List<EmailCandidate> emails = List.of(
                new EmailCandidate("info@acme.com", 0.8, "website-scrape"),
                new EmailCandidate("sales@acme.com", 0.7, "website-scrape"),
                new EmailCandidate("jane@acme.com", 0.9, "hunter"));

        EnrichmentResult result = EnrichmentResult.found("p1", emails, "Jane Doe", NOW, List.of("hunter"));

        assertThat(result.emails()).hasSize(3);
        assertThat(result.primary().email()).isEqualTo("info@acme.com");
        assertThat(result.enrichmentFailed()).isFalse();
    }

    @Test
    @DisplayName("rejects a fourth email")
    void fourEmailsRejected() {
        List<EmailCandidate> emails = List.of(
                new EmailCandidate("a@acme.com", 0.8, "s"),
                new EmailCandidate("b@acme.com", 0.8, "s"),
                new EmailCandidate("c@acme.com", 0.8, "s"),
                new EmailCandidate("d@acme.com", 0.8, "s"));

        assertThatThrownBy(() -> EnrichmentResult.found("p1", emails, null, NOW, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most 3");
    }

    @Test
    @DisplayName("confidence outside [0,1] is rejected")
    void confidenceBounds() {
        assertThatThrownBy(() -> new EmailCandidate("a@acme.com", 1.01, "s"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmailCandidate("a@acme.com", -0.1, "s"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EmailCandidate("a@acme.com", Double.NaN, "s"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("an empty result must carry the failure marker")
    void emptyMeansFailed() {
        EnrichmentResult failed = EnrichmentResult.failed("p1", NOW, List.of("website-scrape"));
        assertThat(failed.emails()).isEmpty();
        assertThat(failed.enrichmentFailed()).isTrue();
        assertThat(failed.primary()).isNull();

        assertThatThrownBy(() -> new EnrichmentResult("p1", List.of(), null, NOW, false, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void forPlaceKeepsEverythingButTheOwner() {
        EnrichmentResult original = EnrichmentResult.found("p1",
                List.of(new EmailCandidate("info@acme.com", 0.8, "website-scrape")), "Jane Doe", NOW, List.of("website-scrape"));

        EnrichmentResult copy = original.forPlace("p2");

        assertThat(copy.placeId()).isEqualTo("p2");
        assertThat(copy.emails()).isEqualTo(original.emails());
        assertThat(copy.contactName()).isEqualTo("Jane Doe");
        assertThat(copy.enrichedAt()).isEqualTo(NOW);
    }
}
