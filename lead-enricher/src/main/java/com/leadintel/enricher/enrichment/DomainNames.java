package com.leadintel.enricher.enrichment;

import java.net.URI;
import java.util.Locale;

/**
 * Website → bare host, e.g. "https://www.Acme-Plumbing.com/contact" → "acme-plumbing.com".
 */
public final class DomainNames {

    private DomainNames() {
    }

    /** @return the lowercase host without "www.", or null when the website is blank or unparseable */
    public static String of(String website) {
        URI uri = toUri(website);
        if (uri == null || uri.getHost() == null) return null;
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) host = host.substring(4);
        return host.contains(".") ? host : null;
    }

    /** Adds https:// when the listing gives a bare domain. */
    public static URI toUri(String website) {
        if (website == null || website.isBlank()) return null;
        String url = website.trim();
        if (!url.regionMatches(true, 0, "http://", 0, 7) && !url.regionMatches(true, 0, "https://", 0, 8)) {
            url = "https://" + url;
        }
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
