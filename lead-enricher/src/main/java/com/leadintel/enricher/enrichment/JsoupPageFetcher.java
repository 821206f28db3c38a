package com.leadintel.enricher.enrichment;

import com.leadintel.enricher.config.LeadEnricherProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class JsoupPageFetcher implements PageFetcher {

    private final LeadEnricherProperties.Enrichment.Website config;

    public JsoupPageFetcher(LeadEnricherProperties properties) {
        this.config = properties.getEnrichment().getWebsite();
    }

    @Override
    public Document fetch(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.5")
                .timeout((int) config.getTimeout().toMillis())
                .followRedirects(true)
                .get();
    }
}
