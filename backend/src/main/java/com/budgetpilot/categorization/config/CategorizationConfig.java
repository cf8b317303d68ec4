package com.budgetpilot.categorization.config;

import com.budgetpilot.categorization.classifier.CategorizationClassifier;
import com.budgetpilot.categorization.classifier.ClassifierProperties;
import com.budgetpilot.categorization.classifier.HttpCategorizationClassifier;
import com.budgetpilot.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the classifier client with its local rate limiter and retry policy.
 */
@Configuration
@EnableConfigurationProperties({ CategorizationProperties.class, ClassifierProperties.class })
public class CategorizationConfig {

    public static final String CLASSIFIER_RATE_LIMITER = "classifierRateLimiter";

    @Bean(name = CLASSIFIER_RATE_LIMITER)
    public RateLimiter classifierRateLimiter(ClassifierProperties properties) {
        int perMinute = Math.max(1, properties.getRequestsPerMinute());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(perMinute)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of(CLASSIFIER_RATE_LIMITER, config);
    }

    @Bean
    public RetryPolicy classifierRetryPolicy(ClassifierProperties properties) {
        return new RetryPolicy(
                properties.getBaseDelayMs(),
                properties.getJitterFactor(),
                Math.max(1, properties.getMaxAttempts()));
    }

    @Bean
    public CategorizationClassifier categorizationClassifier(WebClient.Builder webClientBuilder,
                                                             ClassifierProperties properties,
                                                             RateLimiter classifierRateLimiter,
                                                             RetryPolicy classifierRetryPolicy) {
        return new HttpCategorizationClassifier(webClientBuilder, properties, classifierRateLimiter, classifierRetryPolicy);
    }
}
