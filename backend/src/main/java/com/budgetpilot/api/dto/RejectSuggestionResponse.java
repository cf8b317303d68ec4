package com.budgetpilot.api.dto;

public record RejectSuggestionResponse(String suggestionId, String status) {
}
