package com.budgetpilot.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * GET /status response. error is null unless has_error; progress is null unless is_processing.
 */
public record CategorizationStatusResponse(long uncategorizedCount,
                                           @JsonProperty("is_processing") boolean isProcessing,
                                           long pendingSuggestionsCount,
                                           long skippedCount,
                                           Instant lastProcessedAt,
                                           boolean hasError,
                                           ErrorInfo error,
                                           ProgressInfo progress) {

    public record ErrorInfo(String code, String message, boolean retryable, Instant timestamp) {
    }

    public record ProgressInfo(int processedTransactions, int totalTransactions, int currentBatch, int totalBatches) {
    }
}
