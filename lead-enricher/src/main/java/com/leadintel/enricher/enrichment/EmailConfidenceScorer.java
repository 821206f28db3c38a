package com.leadintel.enricher.enrichment;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Confidence for a discovered address: the strategy's base score, +0.2 when the address is on
 * the business's own domain, +0.1 for a professional mailbox, -0.3 for throwaway mailboxes.
 * Clamped to [0,1] and rounded to two decimals.
 */
@Component
public class EmailConfidenceScorer {

    private static final List<String> PROFESSIONAL = List.of("info@", "contact@", "hello@", "admin@", "office@");
    private static final List<String> SUSPICIOUS = List.of("noreply@", "no-reply@", "test@", "fake@");

    public double score(String email, String domain, double baseConfidence) {
        String e = email.toLowerCase(Locale.ROOT);
        double confidence = baseConfidence;
        if (domain != null && (e.endsWith("@" + domain) || e.endsWith("." + domain))) {
            confidence += 0.2;
        }
        if (PROFESSIONAL.stream().anyMatch(e::startsWith)) {
            confidence += 0.1;
        }
        if (SUSPICIOUS.stream().anyMatch(e::startsWith)) {
            confidence -= 0.3;
        }
        confidence = Math.min(Math.max(confidence, 0.0), 1.0);
        return Math.round(confidence * 100) / 100.0;
    }
}
