package com.budgetpilot.categorization.job;

import com.budgetpilot.categorization.classifier.AiErrorCode;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Persists run transitions on categorization_jobs. Every write is scoped to (userId, jobId, PROCESSING), so a run
 * that was superseded or failed by the watchdog cannot overwrite newer state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobProgressTracker {

    private final CategorizationJobRepository jobRepository;

    /**
     * Progress after a completed batch.
     *
     * @return false if the run is no longer PROCESSING and should stop
     */
    public boolean recordBatch(String userId, String jobId, CategorizationJob.Progress progress) {
        return jobRepository.updateProgress(userId, jobId, progress);
    }

    /** PROCESSING → COMPLETE, progress cleared, lastProcessedAt set. */
    public boolean markComplete(String userId, String jobId) {
        boolean updated = jobRepository.finishRun(userId, jobId, CategorizationJob.JobStatus.COMPLETE, null);
        if (!updated) {
            log.warn("Categorization run {} for user {} was no longer PROCESSING on completion", jobId, userId);
        }
        return updated;
    }

    /** PROCESSING → ERROR with the given code and message, progress cleared, lastProcessedAt set. */
    public boolean markFailed(String userId, String jobId, AiErrorCode code, String message) {
        CategorizationJob.JobError error = new CategorizationJob.JobError(
                code.name(), message, code.isRetryable(), Instant.now());
        boolean updated = jobRepository.finishRun(userId, jobId, CategorizationJob.JobStatus.ERROR, error);
        if (!updated) {
            log.warn("Categorization run {} for user {} was no longer PROCESSING when failing with {}", jobId, userId, code);
        }
        return updated;
    }
}
