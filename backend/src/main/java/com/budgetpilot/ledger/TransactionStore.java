package com.budgetpilot.ledger;

import com.budgetpilot.domain.Transaction;

import java.util.Collection;
import java.util.List;

/**
 * Read side of the transaction ledger used by the categorization engine.
 */
public interface TransactionStore {

    long countUncategorized(String userId);

    /** Uncategorized count ignoring {@code excludedIds} (transactions already suggested or skipped). */
    long countUncategorized(String userId, Collection<String> excludedIds);

    /** Next slice of uncategorized transactions in (date, id) order, ignoring {@code excludedIds}. */
    List<Transaction> fetchUncategorizedBatch(String userId, Collection<String> excludedIds, int offset, int limit);
}
