package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.config.LeadEnricherProperties;
import com.leadintel.enricher.model.BusinessRecord;
import com.leadintel.enricher.model.EmailCandidate;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free strategy: reads the business website (home page, then a few contact/about pages)
 * and pulls addresses from the page text and mailto links.
 */
@Component
@Slf4j
public class WebsiteScrapeStrategy implements EnrichmentStrategy {

    public static final String NAME = "website-scrape";

    private static final Pattern CONTACT_LABEL =
            Pattern.compile("(?:Contact|Manager|Owner|Director):\\s*([A-Z][a-z]+\\s+[A-Z][a-z]+)");

    private static final String NAME_SELECTORS =
            ".contact-name, .manager, .owner, .director, .team-member, .staff-name, .contact-person";

    private final PageFetcher fetcher;
    private final EmailConfidenceScorer scorer;
    private final LeadEnricherProperties.Enrichment.Website config;

    public WebsiteScrapeStrategy(PageFetcher fetcher, EmailConfidenceScorer scorer, LeadEnricherProperties properties) {
        this.fetcher = fetcher;
        this.scorer = scorer;
        this.config = properties.getEnrichment().getWebsite();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(BusinessRecord business) {
        return DomainNames.toUri(business.getWebsite()) != null;
    }

    @Override
    public StrategyOutcome attempt(BusinessRecord business) {
        URI home = DomainNames.toUri(business.getWebsite());
        String domain = DomainNames.of(business.getWebsite());

        Set<String> emails = new LinkedHashSet<>();
        String contactName;
        try {
            Document doc = fetcher.fetch(home.toString());
            emails.addAll(emailsIn(doc));
            contactName = contactNameIn(doc);
        } catch (IOException e) {
            return StrategyOutcome.error("home page " + home + " unreachable: " + e.getMessage(), BigDecimal.ZERO);
        }

        List<String> paths = config.getContactPaths();
        int limit = Math.min(config.getMaxContactPages(), paths.size());
        for (int i = 0; i < limit && emails.isEmpty(); i++) {
            String url = home.resolve(paths.get(i)).toString();
            try {
                Document doc = fetcher.fetch(url);
                emails.addAll(emailsIn(doc));
                if (contactName == null) contactName = contactNameIn(doc);
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Contact page {} not readable: {}", url, e.getMessage());
            }
        }

        if (emails.isEmpty()) {
            return StrategyOutcome.noMatch(BigDecimal.ZERO);
        }
        List<EmailCandidate> candidates = emails.stream()
                .map(e -> new EmailCandidate(e, scorer.score(e, domain, config.getBaseConfidence()), NAME))
                .sorted((a, b) -> Double.compare(b.confidence(), a.confidence()))
                .toList();
        log.debug("Website {} yielded {} address(es)", home, candidates.size());
        return StrategyOutcome.match(candidates, contactName, BigDecimal.ZERO);
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    static Set<String> emailsIn(Document doc) {
        Set<String> found = new LinkedHashSet<>();
        for (Element link : doc.select("a[href^=mailto:]")) {
            String email = EmailExtractor.clean(link.attr("href"));
            if (EmailExtractor.isValid(email)) found.add(email);
        }
        found.addAll(EmailExtractor.extract(doc.text()));
        return found;
    }

    static String contactNameIn(Document doc) {
        Matcher m = CONTACT_LABEL.matcher(doc.text());
        if (m.find()) return m.group(1);

        for (Element el : doc.select(NAME_SELECTORS)) {
            String text = el.text().trim();
            if (!text.isEmpty() && text.split("\\s+").length == 2) {
                return text;
            }
        }
        return null;
    }
}
