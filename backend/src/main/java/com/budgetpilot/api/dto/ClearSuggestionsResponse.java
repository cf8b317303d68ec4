package com.budgetpilot.api.dto;

public record ClearSuggestionsResponse(long clearedSuggestions, long clearedSkipped) {
}
