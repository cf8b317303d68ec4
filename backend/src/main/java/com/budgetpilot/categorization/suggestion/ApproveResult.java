package com.budgetpilot.categorization.suggestion;

/**
 * Outcome of an approval. {@code transactionsCategorized} counts only transactions that were still uncategorized.
 */
public record ApproveResult(String suggestionId,
                            String categoryId,
                            String categoryName,
                            String ruleId,
                            long transactionsCategorized,
                            boolean newCategory) {
}
