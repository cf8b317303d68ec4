package com.budgetpilot.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApproveSuggestionResponse(String suggestionId,
                                        String categoryId,
                                        String categoryName,
                                        String ruleId,
                                        long transactionsCategorized,
                                        @JsonProperty("is_new_category") boolean isNewCategory) {
}
