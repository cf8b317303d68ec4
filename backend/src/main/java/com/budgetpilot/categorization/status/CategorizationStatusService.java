package com.budgetpilot.categorization.status;

import com.budgetpilot.categorization.suggestion.SuggestionStore;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationJobRepository;
import com.budgetpilot.ledger.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Read-only status for polling clients. Reads persisted state only, so it never waits on a running batch.
 */
@Service
@RequiredArgsConstructor
public class CategorizationStatusService {

    private final CategorizationJobRepository jobRepository;
    private final TransactionStore transactionStore;
    private final SuggestionStore suggestionStore;

    public CategorizationStatus getStatus(String userId) {
        CategorizationJob job = jobRepository.findByUserId(userId).orElse(null);
        Set<String> suggested = suggestionStore.heldTransactionIds(userId);
        // uncategorized transactions not already held by a pending suggestion
        long uncategorized = transactionStore.countUncategorized(userId, suggested);
        boolean processing = job != null && job.isProcessing();
        boolean hasError = job != null && job.getStatus() == CategorizationJob.JobStatus.ERROR && job.getLastError() != null;
        return new CategorizationStatus(
                uncategorized,
                processing,
                suggestionStore.countPending(userId),
                suggestionStore.countSkipped(userId),
                job != null ? job.getLastProcessedAt() : null,
                hasError,
                hasError ? job.getLastError() : null,
                processing ? job.getProgress() : null);
    }
}
