package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Free last resort: common role mailboxes (info@, contact@, ...) on the business domain.
 * Nothing is verified, hence the low base confidence.
 */
@Component
public class PatternGenerationStrategy implements EnrichmentStrategy {

    public static final String NAME = "pattern-generation";

    private final EmailConfidenceScorer scorer;
    private final LeadEnricherProperties.Enrichment.Pattern config;

    public PatternGenerationStrategy(EmailConfidenceScorer scorer, LeadEnricherProperties properties) {
        this.scorer = scorer;
        this.config = properties.getEnrichment().getPattern();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(BusinessRecord business) {
        return DomainNames.of(business.getWebsite()) != null;
    }

    @Override
    public StrategyOutcome attempt(BusinessRecord business) {
        String domain = DomainNames.of(business.getWebsite());
        List<EmailCandidate> candidates = config.getMailboxes().stream()
                .map(mailbox -> mailbox + "@" + domain)
                .filter(EmailExtractor::isValid)
                .map(email -> new EmailCandidate(email, scorer.score(email, domain, config.getBaseConfidence()), NAME))
                .toList();
        return candidates.isEmpty()
                ? StrategyOutcome.noMatch(BigDecimal.ZERO)
                : StrategyOutcome.match(candidates, null, BigDecimal.ZERO);
    }
}
