package com.leadintel.enricher.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Paid strategy: Hunter.io domain search.
 *
 * Billing: a flat per-request cost plus a per-email cost for every address returned.
 * A request that got an HTTP answer is billed (at zero when the API refused it); a request
 * that never got an answer is not.
 */
@Component
@Slf4j
public class HunterEmailFinderStrategy implements EnrichmentStrategy {

    public static final String NAME = "hunter";

    private final RestTemplate restTemplate;
    private final EmailConfidenceScorer scorer;
    private final LeadEnricherProperties.Enrichment.Hunter config;
    private final int maxEmails;

    public HunterEmailFinderStrategy(RestTemplate restTemplate, EmailConfidenceScorer scorer,
                                     LeadEnricherProperties properties) {
        this.restTemplate = restTemplate;
        this.scorer = scorer;
        this.config = properties.getEnrichment().getHunter();
        this.maxEmails = properties.getEnrichment().getMaxEmails();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(BusinessRecord business) {
        return config.isEnabled()
                && config.getApiKey() != null && !config.getApiKey().isBlank()
                && DomainNames.of(business.getWebsite()) != null;
    }

    @Override
    public boolean billable() {
        return true;
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
    public BigDecimal estimatedCost(BusinessRecord business) {
        return costFor(maxEmails);
    }

    @Override
    public StrategyOutcome attempt(BusinessRecord business) {
        String domain = DomainNames.of(business.getWebsite());
        String url = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .queryParam("domain", domain)
                .queryParam("api_key", config.getApiKey())
                .queryParam("limit", maxEmails)
                .toUriString();

        JsonNode body;
        try {
            body = restTemplate.getForObject(url, JsonNode.class);
        } catch (RestClientResponseException e) {
            return StrategyOutcome.error("Hunter.io HTTP " + e.getStatusCode().value() + " for " + domain,
                    BigDecimal.ZERO);
        } catch (ResourceAccessException e) {
            return StrategyOutcome.error("Hunter.io unreachable: " + e.getMessage(), null);
        }

        List<EmailCandidate> candidates = new ArrayList<>();
        String contactName = null;
        JsonNode emails = body == null ? null : body.path("data").path("emails");
        if (emails != null && emails.isArray()) {
            for (JsonNode e : emails) {
                String email = EmailExtractor.clean(e.path("value").asText(null));
                if (!EmailExtractor.isValid(email)) continue;
                candidates.add(new EmailCandidate(email, scorer.score(email, domain, config.getBaseConfidence()), NAME));
                if (contactName == null) contactName = fullName(e);
            }
        }

        BigDecimal cost = costFor(candidates.size());
        log.debug("Hunter.io found {} emails for {} (cost {})", candidates.size(), domain, cost);
        return candidates.isEmpty()
                ? StrategyOutcome.noMatch(cost)
                : StrategyOutcome.match(candidates, contactName, cost);
    }

    private BigDecimal costFor(int emails) {
        return config.getCostPerRequest().add(config.getCostPerEmail().multiply(BigDecimal.valueOf(emails)));
    }

    private String fullName(JsonNode email) {
        String name = (email.path("first_name").asText("") + " " + email.path("last_name").asText("")).trim();
        return name.isEmpty() ? null : name;
    }
}
