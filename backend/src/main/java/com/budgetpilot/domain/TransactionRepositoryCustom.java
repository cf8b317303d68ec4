package com.budgetpilot.domain;

import java.util.Collection;
import java.util.List;

/**
 * Custom queries over uncategorized transactions.
 */
public interface TransactionRepositoryCustom {

    long countUncategorized(String userId);

    long countUncategorizedExcluding(String userId, Collection<String> excludedIds);

    /** Uncategorized transactions ordered by (date, id), skipping {@code excludedIds}. */
    List<Transaction> findUncategorized(String userId, Collection<String> excludedIds, int offset, int limit);

    /** Sets categoryId on those ids that are still uncategorized. Returns the number modified. */
    long applyCategory(String userId, String categoryId, Collection<String> transactionIds);
}
