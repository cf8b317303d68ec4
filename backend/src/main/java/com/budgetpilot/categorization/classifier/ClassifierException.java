package com.budgetpilot.categorization.classifier;

import lombok.Getter;

/**
 * Thrown by {@link CategorizationClassifier} when a batch could not be classified.
 * The batch runner ends the run in ERROR with {@link #getCode()}.
 */
@Getter
public class ClassifierException extends RuntimeException {

    private final AiErrorCode code;

    public ClassifierException(AiErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ClassifierException(AiErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
