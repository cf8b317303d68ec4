package com.budgetpilot.categorization.job;

import com.budgetpilot.categorization.CategorizationException;
import com.budgetpilot.categorization.classifier.AiErrorCode;
import com.budgetpilot.categorization.config.CategorizationProperties;
import com.budgetpilot.categorization.suggestion.SuggestionStore;
import com.budgetpilot.config.AsyncConfig;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationJobRepository;
import com.budgetpilot.ledger.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-user categorization job state machine: IDLE/COMPLETE/ERROR → PROCESSING → COMPLETE | ERROR.
 * A user has at most one PROCESSING run, guarded in-process by an in-flight set and across instances by a
 * conditional upsert on the job document. Runs execute on categorization-executor.
 */
@Service
@Slf4j
public class CategorizationJobService {

    private final CategorizationJobRepository jobRepository;
    private final TransactionStore transactionStore;
    private final SuggestionStore suggestionStore;
    private final CategorizationBatchRunner batchRunner;
    private final JobProgressTracker progressTracker;
    private final CategorizationProperties properties;
    private final Executor executor;

    /** Users with a run executing in this process. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public CategorizationJobService(CategorizationJobRepository jobRepository,
                                    TransactionStore transactionStore,
                                    SuggestionStore suggestionStore,
                                    CategorizationBatchRunner batchRunner,
                                    JobProgressTracker progressTracker,
                                    CategorizationProperties properties,
                                    @Qualifier(AsyncConfig.CATEGORIZATION_EXECUTOR) Executor executor) {
        this.jobRepository = jobRepository;
        this.transactionStore = transactionStore;
        this.suggestionStore = suggestionStore;
        this.batchRunner = batchRunner;
        this.progressTracker = progressTracker;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Starts (or, after ERROR, resumes) categorization of the user's remaining uncategorized transactions.
     * The remaining set excludes transactions held by pending suggestions and, when resuming from ERROR,
     * those the failed run skipped.
     *
     * @throws CategorizationException ALREADY_PROCESSING if a run is already PROCESSING for the user
     */
    public StartResult start(String userId) {
        if (!inFlight.add(userId)) {
            throw CategorizationException.alreadyProcessing(userId);
        }
        boolean submitted = false;
        try {
            Optional<CategorizationJob> previous = jobRepository.findByUserId(userId);
            if (previous.map(CategorizationJob::isProcessing).orElse(false)) {
                throw CategorizationException.alreadyProcessing(userId);
            }
            boolean resumingFromError = previous
                    .map(j -> j.getStatus() == CategorizationJob.JobStatus.ERROR)
                    .orElse(false);

            Set<String> exclusions = new HashSet<>(suggestionStore.heldTransactionIds(userId));
            if (resumingFromError && previous.get().getJobId() != null) {
                exclusions.addAll(suggestionStore.skippedTransactionIds(userId, previous.get().getJobId()));
            }
            int remaining = (int) transactionStore.countUncategorized(userId, exclusions);
            String jobId = UUID.randomUUID().toString();

            if (remaining == 0) {
                jobRepository.markNothingToProcess(userId, jobId)
                        .orElseThrow(() -> CategorizationException.alreadyProcessing(userId));
                log.info("Categorization for user {}: nothing to process", userId);
                return new StartResult(jobId, StartResult.COMPLETE, 0, "No uncategorized transactions to process");
            }

            CategorizationJob.Progress progress = CategorizationJob.Progress.initial(remaining, batchSize());
            jobRepository.tryStartProcessing(userId, jobId, progress, resumingFromError)
                    .orElseThrow(() -> CategorizationException.alreadyProcessing(userId));
            submit(userId, jobId, exclusions, progress);
            submitted = true;
            log.info("Categorization run {} started for user {}: {} transactions in {} batches{}",
                    jobId, userId, remaining, progress.getTotalBatches(), resumingFromError ? " (resumed after error)" : "");
            String message = resumingFromError
                    ? "Categorization started for remaining " + remaining + " transactions"
                    : "Categorization started for " + remaining + " transactions";
            return new StartResult(jobId, StartResult.PROCESSING, remaining, message);
        } finally {
            if (!submitted) {
                inFlight.remove(userId);
            }
        }
    }

    /** Resumes runs a previous process left PROCESSING. */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeInterruptedRuns() {
        if (!properties.isResumeOnStartup()) {
            return;
        }
        for (CategorizationJob job : jobRepository.findByStatus(CategorizationJob.JobStatus.PROCESSING)) {
            try {
                resume(job);
            } catch (RuntimeException e) {
                log.error("Could not resume categorization run {} for user {}: {}", job.getJobId(), job.getUserId(), e.getMessage(), e);
            }
        }
    }

    void resume(CategorizationJob job) {
        String userId = job.getUserId();
        String jobId = job.getJobId();
        if (!inFlight.add(userId)) {
            return;
        }
        boolean submitted = false;
        try {
            Set<String> exclusions = new HashSet<>(suggestionStore.heldTransactionIds(userId));
            exclusions.addAll(suggestionStore.skippedTransactionIds(userId, jobId));
            if (job.isResumedFromError()) {
                exclusions.addAll(suggestionStore.skippedTransactionIds(userId));
            }
            int remaining = (int) transactionStore.countUncategorized(userId, exclusions);
            CategorizationJob.Progress before = job.getProgress() != null
                    ? job.getProgress()
                    : new CategorizationJob.Progress(0, 0, 0, 0);
            if (remaining == 0) {
                progressTracker.markComplete(userId, jobId);
                log.info("Interrupted categorization run {} for user {} had nothing left; marked COMPLETE", jobId, userId);
                return;
            }
            CategorizationJob.Progress resumed = new CategorizationJob.Progress(
                    before.getProcessedTransactions(),
                    before.getProcessedTransactions() + remaining,
                    before.getCurrentBatch(),
                    before.getCurrentBatch() + CategorizationJob.Progress.initial(remaining, batchSize()).getTotalBatches());
            if (!progressTracker.recordBatch(userId, jobId, resumed)) {
                return;
            }
            submit(userId, jobId, exclusions, resumed);
            submitted = true;
            log.info("Resumed categorization run {} for user {}: {} transactions left", jobId, userId, remaining);
        } finally {
            if (!submitted) {
                inFlight.remove(userId);
            }
        }
    }

    /** Fails PROCESSING runs that stopped reporting progress and are not executing in this process. */
    @Scheduled(fixedDelayString = "${budgetpilot.categorization.stale-check-interval-ms:60000}")
    public void failStalledRuns() {
        Instant cutoff = Instant.now().minusMillis(properties.getStaleAfterMs());
        for (CategorizationJob job : jobRepository.findByStatus(CategorizationJob.JobStatus.PROCESSING)) {
            if (inFlight.contains(job.getUserId()) || job.getUpdatedAt() == null || job.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            log.warn("Categorization run {} for user {} stalled since {}; marking ERROR", job.getJobId(), job.getUserId(), job.getUpdatedAt());
            progressTracker.markFailed(job.getUserId(), job.getJobId(), AiErrorCode.INTERNAL_ERROR,
                    "Categorization stopped responding. Start again to continue.");
        }
    }

    boolean isInFlight(String userId) {
        return inFlight.contains(userId);
    }

    private void submit(String userId, String jobId, Set<String> exclusions, CategorizationJob.Progress progress) {
        try {
            executor.execute(() -> execute(userId, jobId, exclusions, progress));
        } catch (RejectedExecutionException e) {
            log.error("Categorization run {} for user {} rejected by executor: {}", jobId, userId, e.getMessage());
            progressTracker.markFailed(userId, jobId, AiErrorCode.INTERNAL_ERROR, "Categorization could not be scheduled");
            throw e;
        }
    }

    private void execute(String userId, String jobId, Set<String> exclusions, CategorizationJob.Progress progress) {
        RunOutcome outcome;
        try {
            outcome = batchRunner.run(userId, jobId, exclusions, progress);
        } finally {
            // must precede the final status write
            inFlight.remove(userId);
        }
        switch (outcome.kind()) {
            case COMPLETE -> progressTracker.markComplete(userId, jobId);
            case FAILED -> progressTracker.markFailed(userId, jobId, outcome.errorCode(), outcome.message());
            case SUPERSEDED -> log.debug("Run {} superseded; no final write", jobId);
        }
    }

    private int batchSize() {
        return Math.max(1, properties.getBatchSize());
    }
}
