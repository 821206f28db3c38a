package com.leadintel.enricher.service;

/**
 * 401/403 from the search provider. Never retried; fails the job.
 */
public class ProviderAuthException extends RuntimeException {

    public ProviderAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
