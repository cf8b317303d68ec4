package com.budgetpilot.categorization.suggestion;

import com.budgetpilot.categorization.CategorizationException;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationJobRepository;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.CategorizationSuggestionRepository;
import com.budgetpilot.domain.SkippedTransaction;
import com.budgetpilot.domain.SkippedTransactionRepository;
import com.budgetpilot.domain.SuggestedCategory;
import com.budgetpilot.domain.SuggestionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable suggestions and skipped records. Written by the batch runner, read by status/listing, resolved by review.
 * A transaction id is held by at most one PENDING suggestion per user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SuggestionStore {

    static final String WITHDRAWN_REASON = "SUPERSEDED";

    private final CategorizationSuggestionRepository suggestionRepository;
    private final SkippedTransactionRepository skippedRepository;
    private final CategorizationJobRepository jobRepository;

    /**
     * Stores a draft: merged into the user's PENDING suggestion with the same keyword, or inserted as a new one.
     * Transactions already held by another suggestion (PENDING, or APPROVED with the commit outstanding) are dropped
     * from the draft.
     *
     * @return the stored suggestion, or empty when nothing was left to store
     */
    public Optional<CategorizationSuggestion> append(String userId, String jobId, int batchNumber, SuggestionDraft draft) {
        Map<String, CategorizationSuggestion.AffectedTransaction> byId = new LinkedHashMap<>();
        for (CategorizationSuggestion.AffectedTransaction t : draft.transactions()) {
            byId.putIfAbsent(t.getId(), t);
        }
        if (byId.isEmpty()) {
            return Optional.empty();
        }
        Set<String> owned = suggestionRepository.findHeldAmong(userId, byId.keySet(), null);
        List<CategorizationSuggestion.AffectedTransaction> free = byId.values().stream()
                .filter(t -> !owned.contains(t.getId()))
                .toList();
        if (free.isEmpty()) {
            log.debug("Grouping '{}' for user {} dropped: all transactions already suggested", draft.match().getKeyword(), userId);
            return Optional.empty();
        }

        String matchKey = CategorizationSuggestion.matchKey(draft.match().getKeyword());
        Optional<CategorizationSuggestion> merged = suggestionRepository.appendToPending(userId, matchKey, jobId, batchNumber, free);
        if (merged.isPresent()) {
            log.debug("Merged {} transactions into suggestion {} ({})", free.size(), merged.get().getId(), matchKey);
            return merged;
        }

        Instant now = Instant.now();
        CategorizationSuggestion suggestion = new CategorizationSuggestion();
        suggestion.setUserId(userId);
        suggestion.setCategory(draft.category());
        suggestion.setMatch(draft.match());
        suggestion.setMatchKey(matchKey);
        suggestion.setAffectedTransactions(new ArrayList<>(free));
        suggestion.setTransactionIds(free.stream().map(CategorizationSuggestion.AffectedTransaction::getId)
                .collect(Collectors.toCollection(ArrayList::new)));
        suggestion.setStatus(SuggestionStatus.PENDING);
        suggestion.setJobId(jobId);
        suggestion.setBatchNumber(batchNumber);
        suggestion.setCreatedAt(now);
        suggestion.setUpdatedAt(now);
        return Optional.of(suggestionRepository.save(suggestion));
    }

    public void appendSkipped(List<SkippedTransaction> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        skippedRepository.saveAll(records);
    }

    /** Removes skipped records for transactions that a later batch re-attempted. */
    public long clearSkipped(String userId, Collection<String> transactionIds) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            return 0;
        }
        return skippedRepository.deleteByUserIdAndTransactionIdIn(userId, transactionIds);
    }

    public SuggestionsView listPending(String userId) {
        List<CategorizationSuggestion> pending =
                suggestionRepository.findByUserIdAndStatusOrderByCreatedAtAsc(userId, SuggestionStatus.PENDING);
        List<SkippedTransaction> skipped = skippedRepository.findByUserIdOrderByCreatedAtAsc(userId);
        boolean partial = jobRepository.findByUserId(userId)
                .map(CategorizationJob::isProcessing)
                .orElse(false);
        return new SuggestionsView(pending, skipped, pending.size(), skipped.size(), partial);
    }

    /**
     * Compare-and-swap PENDING → {@code target}.
     *
     * @throws CategorizationException NOT_FOUND if the user has no such suggestion; ALREADY_RESOLVED if it is not PENDING
     */
    public CategorizationSuggestion claim(String userId, String suggestionId, SuggestionStatus target, String rejectionReason) {
        return suggestionRepository.claim(userId, suggestionId, target, rejectionReason)
                .orElseThrow(() -> suggestionRepository.findByIdAndUserId(suggestionId, userId).isPresent()
                        ? new CategorizationException(CategorizationException.ALREADY_RESOLVED,
                                "Suggestion already resolved: " + suggestionId)
                        : new CategorizationException(CategorizationException.NOT_FOUND,
                                "Suggestion not found: " + suggestionId));
    }

    /**
     * Puts an APPROVED suggestion back to PENDING after its ledger commit failed. Transactions another suggestion
     * took in the meantime stay with that suggestion; if none are left the approval is withdrawn instead.
     *
     * @return true if the suggestion is PENDING again
     */
    public boolean release(String userId, String suggestionId) {
        Optional<CategorizationSuggestion> approved = suggestionRepository.findByIdAndUserId(suggestionId, userId)
                .filter(s -> s.getStatus() == SuggestionStatus.APPROVED && s.getCommittedCategoryId() == null);
        if (approved.isEmpty()) {
            return false;
        }
        CategorizationSuggestion suggestion = approved.get();
        Set<String> taken = suggestionRepository.findHeldAmong(userId, suggestion.getTransactionIds(), suggestionId);
        List<CategorizationSuggestion.AffectedTransaction> kept = suggestion.getAffectedTransactions().stream()
                .filter(t -> !taken.contains(t.getId()))
                .toList();
        if (kept.isEmpty()) {
            log.warn("Suggestion {} for user {} withdrawn: all {} transactions now held by other suggestions",
                    suggestionId, userId, taken.size());
            suggestionRepository.withdraw(suggestionId, WITHDRAWN_REASON);
            return false;
        }
        if (!taken.isEmpty()) {
            log.warn("Suggestion {} for user {} reopened without {} transactions now held by other suggestions",
                    suggestionId, userId, taken.size());
        }
        return suggestionRepository.reopen(suggestionId, kept);
    }

    public void recordCommit(String suggestionId, SuggestedCategory category, CategorizationSuggestion.Match match,
                             String categoryId, String ruleId) {
        suggestionRepository.recordCommit(suggestionId, category, match, categoryId, ruleId);
    }

    /** Deletes all PENDING suggestions and skipped records of the user. Resolved suggestions are kept. */
    public ClearResult clearAll(String userId) {
        long suggestions = suggestionRepository.deleteByUserIdAndStatus(userId, SuggestionStatus.PENDING);
        long skipped = skippedRepository.deleteByUserId(userId);
        log.info("Cleared {} pending suggestions and {} skipped records for user {}", suggestions, skipped, userId);
        return new ClearResult(suggestions, skipped);
    }

    public long countPending(String userId) {
        return suggestionRepository.countByUserIdAndStatus(userId, SuggestionStatus.PENDING);
    }

    public long countSkipped(String userId) {
        return skippedRepository.countByUserId(userId);
    }

    /** Transaction ids held by pending suggestions or by approvals still being committed. */
    public Set<String> heldTransactionIds(String userId) {
        return suggestionRepository.findHeldTransactionIds(userId);
    }

    public Set<String> skippedTransactionIds(String userId) {
        return skippedRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
                .map(SkippedTransaction::getTransactionId)
                .collect(Collectors.toSet());
    }

    /** Transactions skipped by the given run. */
    public Set<String> skippedTransactionIds(String userId, String jobId) {
        return skippedRepository.findByUserIdAndJobId(userId, jobId).stream()
                .map(SkippedTransaction::getTransactionId)
                .collect(Collectors.toSet());
    }
}
