package com.leadintel.enricher.service;

/**
 * Timeout, connection failure, 429 or 5xx from an external provider. Retried by the
 * searchProvider retry policy; once retries are exhausted the current page is abandoned.
 */
public class TransientProviderException extends RuntimeException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
