package com.budgetpilot.categorization.suggestion;

import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.SkippedTransaction;

import java.util.List;

/**
 * Pending suggestions and skipped records as currently stored. {@code partial} is true while a run is still adding to them.
 */
public record SuggestionsView(List<CategorizationSuggestion> suggestions,
                              List<SkippedTransaction> skipped,
                              long totalPending,
                              long totalSkipped,
                              boolean partial) {
}
