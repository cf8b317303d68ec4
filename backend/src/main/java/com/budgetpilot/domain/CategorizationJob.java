package com.budgetpilot.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * AI categorization run state, one document per user (the document id is stable, {@code jobId} changes per run).
 * {@code progress} is non-null only while PROCESSING; {@code lastError} only after a failed run.
 */
@Document(collection = "categorization_jobs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CategorizationJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String userId;
    private String jobId;
    private JobStatus status;
    private Progress progress;
    private JobError lastError;
    /** True when the current (or last) run resumed after an ERROR run. */
    private boolean resumedFromError;
    private Instant startedAt;
    private Instant lastProcessedAt;
    private Instant updatedAt;

    public boolean isProcessing() {
        return status == JobStatus.PROCESSING;
    }

    public enum JobStatus {
        IDLE,
        PROCESSING,
        COMPLETE,
        ERROR
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Progress {
        private int processedTransactions;
        private int totalTransactions;
        private int currentBatch;
        private int totalBatches;

        public static Progress initial(int totalTransactions, int batchSize) {
            int batches = totalTransactions == 0 ? 0 : (totalTransactions + batchSize - 1) / batchSize;
            return new Progress(0, totalTransactions, 0, batches);
        }
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class JobError {
        private String code;
        private String message;
        private boolean retryable;
        private Instant timestamp;
    }
}
