package com.budgetpilot.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Optional body of POST /suggestions/{id}/approve. Any field set turns the approval into an edit.
 */
public record ApproveSuggestionRequest(
        String categoryId,
        @Size(max = 100) String categoryName,
        @Size(max = 50) String categoryIcon,
        @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "must be a hex colour like #6B7280") String categoryColor,
        @Pattern(regexp = "(?i)^(contains|exact)$", message = "must be contains or exact") String matchType,
        @Size(max = 200) String keyword) {
}
