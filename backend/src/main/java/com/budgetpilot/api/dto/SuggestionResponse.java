package com.budgetpilot.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One pending suggestion. affected_transactions may be a preview; affected_count is the full count.
 */
public record SuggestionResponse(String id,
                                 CategoryView category,
                                 MatchView match,
                                 List<AffectedTransactionView> affectedTransactions,
                                 int affectedCount,
                                 String status,
                                 Instant createdAt) {

    /** type "existing" carries existing_*; type "new" carries new_*. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CategoryView(String type,
                               String existingId,
                               String existingName,
                               String existingIcon,
                               String existingColor,
                               String newName,
                               String newIcon,
                               String newColor) {

        public static CategoryView existing(String id, String name, String icon, String color) {
            return new CategoryView("existing", id, name, icon, color, null, null, null);
        }

        public static CategoryView proposed(String name, String icon, String color) {
            return new CategoryView("new", null, null, null, null, name, icon, color);
        }
    }

    public record MatchView(String type, String keyword) {
    }

    /** amount in minor units (negative for expenses); date as YYYY-MM-DD. */
    public record AffectedTransactionView(String id, String description, long amount, LocalDate date) {
    }
}
