package com.budgetpilot.categorization.classifier;

/**
 * Error codes a categorization run can end with. All are retryable by starting the run again.
 */
public enum AiErrorCode {
    AI_RATE_LIMITED(true),
    AI_TIMEOUT(true),
    AI_SERVICE_UNAVAILABLE(true),
    AI_INVALID_RESPONSE(true),
    INTERNAL_ERROR(true);

    private final boolean retryable;

    AiErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Transient failures worth another call within the same batch. */
    public boolean isTransient() {
        return this == AI_RATE_LIMITED || this == AI_SERVICE_UNAVAILABLE;
    }
}
