package com.budgetpilot.categorization.job;

/**
 * Result of a start request. {@code status} is "processing" when a run was submitted,
 * "complete" when there was nothing left to categorize.
 */
public record StartResult(String jobId, String status, int transactionsToProcess, String message) {

    public static final String PROCESSING = "processing";
    public static final String COMPLETE = "complete";
}
