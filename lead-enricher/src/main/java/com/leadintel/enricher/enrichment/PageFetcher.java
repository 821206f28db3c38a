package com.leadintel.enricher.enrichment;

import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * Fetches and parses one HTML page.
 */
public interface PageFetcher {

    Document fetch(String url) throws IOException;
}
