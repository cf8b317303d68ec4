package com.budgetpilot.categorization.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Categorization run config: batch partitioning, API preview size, worker pool and recovery.
 */
@ConfigurationProperties(prefix = "budgetpilot.categorization")
@NoArgsConstructor
@Getter
@Setter
public class CategorizationProperties {

    /** Transactions sent to the classifier per call. Default 40. */
    private int batchSize = 40;

    /** Max affected transactions returned per suggestion by the API; affected_count is always the full count. */
    private int previewLimit = 20;

    /** Size of categorization-executor, i.e. how many users can be categorized at the same time. Default 4. */
    private int executorThreads = 4;

    /** Resume runs left PROCESSING by a previous process on application start. */
    private boolean resumeOnStartup = true;

    /**
     * A PROCESSING run with no progress update for longer than this is failed with INTERNAL_ERROR
     * so the user can start again. Must exceed the worst-case duration of one batch including retries.
     */
    private long staleAfterMs = 600_000;

    /** How often (ms) the stalled-run watchdog runs. */
    private long staleCheckIntervalMs = 60_000;
}
