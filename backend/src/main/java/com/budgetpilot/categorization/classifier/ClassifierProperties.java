package com.budgetpilot.categorization.classifier;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * External AI classification service: endpoint, credentials, timeout, local rate limit and retry.
 */
@ConfigurationProperties(prefix = "budgetpilot.classifier")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    /** Base URL of the classification service; requests go to {@code {baseUrl}/v1/categorize}. */
    private String baseUrl = "http://localhost:8090";

    /** Bearer token sent with each request. Empty means no Authorization header. */
    private String apiKey = "";

    /** Per-call timeout; exceeding it fails the batch with AI_TIMEOUT. */
    private long timeoutMs = 30_000;

    /** Local limiter: max classifier calls per minute across all users. */
    private int requestsPerMinute = 30;

    /** How long a call may wait for a limiter permit. 0 = fail immediately with AI_RATE_LIMITED. */
    private long limiterTimeoutMs = 0;

    /** Calls per batch including the first one. Only AI_RATE_LIMITED and AI_SERVICE_UNAVAILABLE are retried. */
    private int maxAttempts = 2;

    /** Base delay for exponential backoff between attempts. */
    private long baseDelayMs = 1_000;

    /** Jitter factor (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;
}
