package com.budgetpilot.categorization.suggestion;

public record ClearResult(long clearedSuggestions, long clearedSkipped) {
}
