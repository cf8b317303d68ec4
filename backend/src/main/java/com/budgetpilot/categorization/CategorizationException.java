package com.budgetpilot.categorization;

import lombok.Getter;

/**
 * Thrown when a categorization request violates a business rule. The API layer maps
 * NOT_FOUND to 404, ALREADY_RESOLVED and ALREADY_PROCESSING to 409, INVALID_OVERRIDE to 400.
 */
@Getter
public class CategorizationException extends RuntimeException {

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ALREADY_RESOLVED = "ALREADY_RESOLVED";
    public static final String ALREADY_PROCESSING = "ALREADY_PROCESSING";
    public static final String INVALID_OVERRIDE = "INVALID_OVERRIDE";

    private final String errorCode;

    public CategorizationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static CategorizationException alreadyProcessing(String userId) {
        return new CategorizationException(ALREADY_PROCESSING, "Categorization is already running for user " + userId);
    }
}
