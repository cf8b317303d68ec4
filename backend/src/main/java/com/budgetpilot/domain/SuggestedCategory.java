package com.budgetpilot.domain;

/**
 * Category a suggestion proposes: either a category the user already has, or a new one to be created on approval.
 */
public sealed interface SuggestedCategory permits SuggestedCategory.Existing, SuggestedCategory.Proposed {

    String name();

    String icon();

    String color();

    record Existing(String categoryId, String name, String icon, String color) implements SuggestedCategory {
    }

    record Proposed(String name, String icon, String color) implements SuggestedCategory {
    }
}
