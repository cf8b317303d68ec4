package com.budgetpilot.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * GET /suggestions response. is_partial is true while a run may still add suggestions.
 */
public record SuggestionsResponse(List<SuggestionResponse> suggestions,
                                  List<SkippedTransactionResponse> skippedTransactions,
                                  long totalPending,
                                  long totalSkipped,
                                  @JsonProperty("is_partial") boolean isPartial) {
}
