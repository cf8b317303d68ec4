package com.budgetpilot.categorization.suggestion;

import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.SuggestedCategory;

import java.util.List;

/**
 * A grouping from one classifier batch, resolved against the user's categories, ready to be stored.
 */
public record SuggestionDraft(SuggestedCategory category,
                              CategorizationSuggestion.Match match,
                              List<CategorizationSuggestion.AffectedTransaction> transactions) {

    public SuggestionDraft {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
