package com.budgetpilot.domain;

import java.util.Optional;

/**
 * Atomic state transitions for categorization_jobs.
 */
public interface CategorizationJobRepositoryCustom {

    /**
     * Moves the user's job to PROCESSING unless it already is. Creates the document on first start.
     *
     * @return the updated job, or empty when a run is already PROCESSING for this user
     */
    Optional<CategorizationJob> tryStartProcessing(String userId, String jobId, CategorizationJob.Progress progress,
                                                   boolean resumedFromError);

    /**
     * Records a start that found nothing to process: COMPLETE without entering PROCESSING.
     *
     * @return the updated job, or empty when a run is already PROCESSING for this user
     */
    Optional<CategorizationJob> markNothingToProcess(String userId, String jobId);

    /** Updates progress of the given run; no-op if the run is no longer PROCESSING. */
    boolean updateProgress(String userId, String jobId, CategorizationJob.Progress progress);

    /** Ends the given run as COMPLETE or ERROR (with error). No-op if the run is no longer PROCESSING. */
    boolean finishRun(String userId, String jobId, CategorizationJob.JobStatus status, CategorizationJob.JobError error);
}
