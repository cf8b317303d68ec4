package com.budgetpilot.categorization.job;

import com.budgetpilot.categorization.classifier.AiErrorCode;
import com.budgetpilot.categorization.classifier.CategorizationClassifier;
import com.budgetpilot.categorization.classifier.ClassificationRequest;
import com.budgetpilot.categorization.classifier.ClassificationResult;
import com.budgetpilot.categorization.classifier.ClassifierException;
import com.budgetpilot.categorization.config.CategorizationProperties;
import com.budgetpilot.categorization.suggestion.SuggestionDraft;
import com.budgetpilot.categorization.suggestion.SuggestionStore;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.Category;
import com.budgetpilot.domain.MatchType;
import com.budgetpilot.domain.SkippedTransaction;
import com.budgetpilot.domain.SuggestedCategory;
import com.budgetpilot.domain.Transaction;
import com.budgetpilot.ledger.CategoryStore;
import com.budgetpilot.ledger.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sequential batch loop for one run: fetch the next slice of eligible transactions, classify it, fold the result into
 * the suggestion store, then advance progress. Stops at the first failed batch; stored suggestions are kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationBatchRunner {

    static final String DEFAULT_ICON = "folder";
    static final String DEFAULT_COLOR = "#6B7280";

    private final TransactionStore transactionStore;
    private final CategoryStore categoryStore;
    private final CategorizationClassifier classifier;
    private final SuggestionStore suggestionStore;
    private final JobProgressTracker progressTracker;
    private final CategorizationProperties properties;

    /**
     * Runs batches until the planned batch count is reached or no eligible transactions remain.
     * Writes progress after each batch but leaves the final COMPLETE/ERROR transition to the caller.
     *
     * @param exclusions transactions not to fetch (already suggested, or skipped by a failed run being resumed)
     * @param start      progress at the start of the run; counters only move forward from here
     */
    public RunOutcome run(String userId, String jobId, Set<String> exclusions, CategorizationJob.Progress start) {
        RunState state = new RunState(start.getProcessedTransactions(), start.getCurrentBatch());
        try {
            return runBatches(userId, jobId, new HashSet<>(exclusions), start, state);
        } catch (RuntimeException e) {
            log.error("Categorization run {} for user {} failed unexpectedly after batch {}: {}",
                    jobId, userId, state.batchNumber, e.getMessage(), e);
            return RunOutcome.failed(AiErrorCode.INTERNAL_ERROR,
                    failureMessage(AiErrorCode.INTERNAL_ERROR, state.batchNumber, pendingCountOrZero(userId)),
                    state.batchesThisRun);
        }
    }

    private RunOutcome runBatches(String userId, String jobId, Set<String> excluded,
                                  CategorizationJob.Progress start, RunState state) {
        int batchSize = Math.max(1, properties.getBatchSize());
        while (state.batchNumber < start.getTotalBatches()) {
            int limit = Math.min(batchSize, start.getTotalTransactions() - state.processed);
            if (limit <= 0) {
                break;
            }
            List<Transaction> batch = transactionStore.fetchUncategorizedBatch(userId, excluded, 0, limit);
            if (batch.isEmpty()) {
                break;
            }
            int current = state.batchNumber + 1;
            for (Transaction t : batch) {
                excluded.add(t.getId());
            }

            ClassificationResult result;
            try {
                result = classifier.classify(buildRequest(userId, batch));
            } catch (ClassifierException e) {
                log.warn("Categorization run {} for user {} failed on batch {}/{}: {} ({})",
                        jobId, userId, current, start.getTotalBatches(), e.getCode(), e.getMessage());
                return RunOutcome.failed(e.getCode(),
                        failureMessage(e.getCode(), state.batchNumber, suggestionStore.countPending(userId)),
                        state.batchesThisRun);
            }

            int stored = foldResult(userId, jobId, current, batch, result);
            state.processed += batch.size();
            state.batchNumber = current;
            state.batchesThisRun++;
            CategorizationJob.Progress progress = new CategorizationJob.Progress(
                    state.processed, start.getTotalTransactions(), state.batchNumber, start.getTotalBatches());
            if (!progressTracker.recordBatch(userId, jobId, progress)) {
                log.warn("Categorization run {} for user {} is no longer PROCESSING; stopping after batch {}",
                        jobId, userId, state.batchNumber);
                return RunOutcome.superseded(state.batchesThisRun);
            }
            log.debug("Run {} batch {}/{}: {} transactions, {} suggestions stored",
                    jobId, state.batchNumber, start.getTotalBatches(), batch.size(), stored);
        }
        log.info("Categorization run {} for user {} finished: {} batches, {}/{} transactions",
                jobId, userId, state.batchNumber, state.processed, start.getTotalTransactions());
        return RunOutcome.complete(state.batchesThisRun);
    }

    /**
     * Writes suggestions for the batch's groupings and skipped records for the rest.
     *
     * @return number of suggestions created or extended
     */
    int foldResult(String userId, String jobId, int batchNumber, List<Transaction> batch, ClassificationResult result) {
        Map<String, Transaction> byId = new LinkedHashMap<>();
        for (Transaction t : batch) {
            byId.put(t.getId(), t);
        }
        List<Category> categories = categoryStore.listCategories(userId);
        Set<String> accounted = new HashSet<>();
        int stored = 0;

        for (ClassificationResult.Grouping grouping : result.groupings()) {
            if (grouping.keyword() == null || grouping.keyword().isBlank()) {
                continue;
            }
            List<CategorizationSuggestion.AffectedTransaction> affected = new ArrayList<>();
            for (String id : grouping.transactionIds()) {
                Transaction t = byId.get(id);
                if (t != null && accounted.add(id)) {
                    affected.add(new CategorizationSuggestion.AffectedTransaction(
                            t.getId(), t.getDescription(), t.getAmount(), t.getDate()));
                }
            }
            if (affected.isEmpty()) {
                continue;
            }
            SuggestionDraft draft = new SuggestionDraft(
                    resolveCategory(grouping.categoryGuess(), categories),
                    new CategorizationSuggestion.Match(parseMatchType(grouping.matchType()), grouping.keyword().strip()),
                    affected);
            if (suggestionStore.append(userId, jobId, batchNumber, draft).isPresent()) {
                stored++;
            }
        }

        Map<String, String> skipReasons = new LinkedHashMap<>();
        for (ClassificationResult.Skip skip : result.skipped()) {
            String id = skip.transactionId();
            if (id != null && byId.containsKey(id) && !accounted.contains(id)) {
                skipReasons.putIfAbsent(id, skip.reason() == null || skip.reason().isBlank()
                        ? SkippedTransaction.REASON_NOT_CLASSIFIED : skip.reason());
            }
        }
        for (String id : byId.keySet()) {
            if (!accounted.contains(id)) {
                skipReasons.putIfAbsent(id, SkippedTransaction.REASON_NOT_CLASSIFIED);
            }
        }

        suggestionStore.clearSkipped(userId, byId.keySet());
        Instant now = Instant.now();
        List<SkippedTransaction> records = new ArrayList<>();
        skipReasons.forEach((id, reason) -> records.add(skipped(userId, jobId, byId.get(id), reason, now)));
        suggestionStore.appendSkipped(records);
        return stored;
    }

    private ClassificationRequest buildRequest(String userId, List<Transaction> batch) {
        List<ClassificationRequest.TransactionItem> items = batch.stream()
                .map(t -> new ClassificationRequest.TransactionItem(t.getId(), t.getDescription(), t.getAmount(),
                        t.getDate() != null ? t.getDate().toString() : null))
                .toList();
        List<ClassificationRequest.CategoryOption> options = categoryStore.listCategories(userId).stream()
                .map(c -> new ClassificationRequest.CategoryOption(c.getId(), c.getName(), c.getIcon(), c.getColor()))
                .toList();
        return new ClassificationRequest(items, options);
    }

    /** Existing by id, then by name (case-insensitive); otherwise a new category with default icon and colour. */
    static SuggestedCategory resolveCategory(ClassificationResult.CategoryGuess guess, List<Category> categories) {
        if (guess == null) {
            return new SuggestedCategory.Proposed("Uncategorized", DEFAULT_ICON, DEFAULT_COLOR);
        }
        Optional<Category> existing = Optional.empty();
        if (guess.existingId() != null) {
            existing = categories.stream().filter(c -> guess.existingId().equals(c.getId())).findFirst();
        }
        if (existing.isEmpty() && guess.name() != null) {
            String name = guess.name().strip();
            existing = categories.stream().filter(c -> c.getName() != null && c.getName().equalsIgnoreCase(name)).findFirst();
        }
        if (existing.isPresent()) {
            Category c = existing.get();
            return new SuggestedCategory.Existing(c.getId(), c.getName(), c.getIcon(), c.getColor());
        }
        String name = guess.name() == null || guess.name().isBlank() ? "Uncategorized" : guess.name().strip();
        return new SuggestedCategory.Proposed(name,
                guess.icon() == null || guess.icon().isBlank() ? DEFAULT_ICON : guess.icon(),
                guess.color() == null || guess.color().isBlank() ? DEFAULT_COLOR : guess.color());
    }

    private static MatchType parseMatchType(String value) {
        try {
            return MatchType.fromWire(value);
        } catch (IllegalArgumentException e) {
            return MatchType.CONTAINS;
        }
    }

    private static SkippedTransaction skipped(String userId, String jobId, Transaction t, String reason, Instant now) {
        SkippedTransaction s = new SkippedTransaction();
        s.setUserId(userId);
        s.setTransactionId(t.getId());
        s.setDescription(t.getDescription());
        s.setAmount(t.getAmount());
        s.setDate(t.getDate());
        s.setReason(reason);
        s.setJobId(jobId);
        s.setCreatedAt(now);
        return s;
    }

    /** e.g. "Rate limited after batch 2. 20 suggestions saved." */
    static String failureMessage(AiErrorCode code, int completedBatches, long suggestionsSaved) {
        String prefix = switch (code) {
            case AI_RATE_LIMITED -> "Rate limited";
            case AI_TIMEOUT -> "AI service timed out";
            case AI_SERVICE_UNAVAILABLE -> "AI service unavailable";
            case AI_INVALID_RESPONSE -> "Invalid AI response";
            case INTERNAL_ERROR -> "Categorization failed";
        };
        return prefix + " after batch " + completedBatches + ". " + suggestionsSaved + " suggestions saved.";
    }

    private long pendingCountOrZero(String userId) {
        try {
            return suggestionStore.countPending(userId);
        } catch (RuntimeException e) {
            log.warn("Could not count pending suggestions for user {}: {}", userId, e.getMessage());
            return 0;
        }
    }

    private static final class RunState {
        int processed;
        int batchNumber;
        int batchesThisRun;

        RunState(int processed, int batchNumber) {
            this.processed = processed;
            this.batchNumber = batchNumber;
        }
    }
}
