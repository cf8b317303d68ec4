package com.budgetpilot.categorization.job;

import com.budgetpilot.categorization.classifier.AiErrorCode;

/**
 * How a batch loop ended. {@code errorCode} and {@code message} are set only for FAILED.
 */
public record RunOutcome(Kind kind, AiErrorCode errorCode, String message, int batchesCompleted) {

    public enum Kind {
        /** All batches processed or the remaining set ran out. */
        COMPLETE,
        /** A batch failed; suggestions from earlier batches are kept. */
        FAILED,
        /** The run lost its PROCESSING state (failed as stalled); nothing more is written. */
        SUPERSEDED
    }

    public static RunOutcome complete(int batchesCompleted) {
        return new RunOutcome(Kind.COMPLETE, null, null, batchesCompleted);
    }

    public static RunOutcome failed(AiErrorCode code, String message, int batchesCompleted) {
        return new RunOutcome(Kind.FAILED, code, message, batchesCompleted);
    }

    public static RunOutcome superseded(int batchesCompleted) {
        return new RunOutcome(Kind.SUPERSEDED, null, null, batchesCompleted);
    }
}
