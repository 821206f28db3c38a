package com.leadintel.enricher.service;

/**
 * A raw search result that cannot become a BusinessRecord. The record is skipped, the job continues.
 */
public class RecordValidationException extends RuntimeException {

    public RecordValidationException(String message) {
        super(message);
    }
}
