package com.budgetpilot.ledger;

import com.budgetpilot.domain.Category;
import com.budgetpilot.domain.MatchType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Write side of the category ledger: categories, keyword rules and category assignment.
 */
public interface CategoryStore {

    List<Category> listCategories(String userId);

    Optional<Category> findById(String userId, String categoryId);

    /** Case-insensitive lookup by name. */
    Optional<Category> findByName(String userId, String name);

    Category createCategory(String userId, NewCategorySpec spec);

    /** Upserts the rule for (userId, keyword) pointing at {@code categoryId}. Returns the rule id. */
    String createOrUpdateRule(String userId, MatchType matchType, String keyword, String categoryId);

    /** Assigns the category to those transactions that are still uncategorized. Returns how many were updated. */
    long applyCategoryToTransactions(String userId, String categoryId, Collection<String> transactionIds);
}
