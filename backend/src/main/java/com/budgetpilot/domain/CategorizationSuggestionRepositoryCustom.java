package com.budgetpilot.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Conditional updates for suggestions. Every method that touches status filters on the expected current status.
 */
public interface CategorizationSuggestionRepositoryCustom {

    /**
     * PENDING → target. Returns the suggestion as updated, or empty if it is missing or no longer PENDING.
     */
    Optional<CategorizationSuggestion> claim(String userId, String id, SuggestionStatus target, String rejectionReason);

    /**
     * APPROVED (uncommitted) → PENDING with the given transactions, used when committing an approval to the ledger failed.
     * Returns false if the suggestion is no longer an uncommitted approval.
     */
    boolean reopen(String id, List<CategorizationSuggestion.AffectedTransaction> transactions);

    /**
     * APPROVED (uncommitted) → REJECTED with {@code reason}, for a failed approval whose transactions all went to
     * other suggestions meanwhile.
     */
    boolean withdraw(String id, String reason);

    /** Stores the effective category, match and commit references on an APPROVED suggestion. */
    void recordCommit(String id, SuggestedCategory category, CategorizationSuggestion.Match match,
                      String committedCategoryId, String ruleId);

    /**
     * Appends transactions to the user's PENDING suggestion with the given match key.
     * Returns empty when no PENDING suggestion with that key exists.
     */
    Optional<CategorizationSuggestion> appendToPending(String userId, String matchKey, String jobId, int batchNumber,
                                                       List<CategorizationSuggestion.AffectedTransaction> transactions);

    /**
     * Transaction ids held by the user's suggestions: PENDING ones, and APPROVED ones whose ledger commit
     * has not been recorded yet.
     */
    Set<String> findHeldTransactionIds(String userId);

    /**
     * Subset of {@code transactionIds} held by one of the user's suggestions other than {@code exceptSuggestionId}
     * (null to consider all).
     */
    Set<String> findHeldAmong(String userId, Collection<String> transactionIds, String exceptSuggestionId);
}
