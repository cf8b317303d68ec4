package com.budgetpilot.ledger;

/**
 * Fields for a category created from an approved suggestion.
 */
public record NewCategorySpec(String name, String icon, String color) {
}
