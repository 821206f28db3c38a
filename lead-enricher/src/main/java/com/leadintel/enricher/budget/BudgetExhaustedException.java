package com.leadintel.enricher.budget;

/**
 * Raised only in strict budget mode, when a search page cannot be authorized.
 * Fails the job; in the default mode a denial just ends pagination.
 */
public class BudgetExhaustedException extends RuntimeException {

    public BudgetExhaustedException(String message) {
        super(message);
    }
}
