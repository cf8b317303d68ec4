package com.budgetpilot.categorization.classifier;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One classifier call: a batch of transactions plus the user's existing categories to choose from.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClassificationRequest(List<TransactionItem> transactions, List<CategoryOption> categories) {

    public ClassificationRequest {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /** Date is ISO-8601 (YYYY-MM-DD); amount in minor units. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TransactionItem(String id, String description, long amount, String date) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CategoryOption(String id, String name, String icon, String color) {
    }
}
