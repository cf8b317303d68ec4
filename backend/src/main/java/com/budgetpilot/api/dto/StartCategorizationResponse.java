package com.budgetpilot.api.dto;

/**
 * POST /start response. status is "processing" or "complete" (nothing to process); both answer 200.
 */
public record StartCategorizationResponse(String jobId, String status, String message, int transactionsToProcess) {
}
