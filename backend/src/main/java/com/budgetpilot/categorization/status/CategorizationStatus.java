package com.budgetpilot.categorization.status;

import com.budgetpilot.domain.CategorizationJob;

import java.time.Instant;

/**
 * Polling projection. {@code error} is non-null only when {@code hasError}; {@code progress} only while processing.
 */
public record CategorizationStatus(long uncategorizedCount,
                                   boolean processing,
                                   long pendingSuggestionsCount,
                                   long skippedCount,
                                   Instant lastProcessedAt,
                                   boolean hasError,
                                   CategorizationJob.JobError error,
                                   CategorizationJob.Progress progress) {
}
