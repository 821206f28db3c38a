package com.leadintel.enricher.model;

/**
 * One discovered email address with its confidence and the strategy that found it.
 */
public record EmailCandidate(String email, double confidence, String source) {

    public EmailCandidate {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1], was " + confidence);
        }
    }
}
