package com.budgetpilot.categorization.classifier;

import com.budgetpilot.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Classifier client over HTTP: POST {baseUrl}/v1/categorize with bearer key. Each call takes a permit from the
 * local rate limiter; rate-limited and unavailable answers are retried with backoff up to the policy's attempts.
 */
@Slf4j
public class HttpCategorizationClassifier implements CategorizationClassifier {

    static final String CATEGORIZE_PATH = "/v1/categorize";

    private final WebClient webClient;
    private final ClassifierProperties properties;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public HttpCategorizationClassifier(WebClient.Builder builder, ClassifierProperties properties,
                                        RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public ClassificationResult classify(ClassificationRequest request) {
        ClassifierException lastException = null;
        for (int attempt = 0; !retryPolicy.isExhausted(attempt); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ClassifierException(AiErrorCode.AI_SERVICE_UNAVAILABLE, "Interrupted during retry", e);
                }
            }
            try {
                return callOnce(request);
            } catch (ClassifierException e) {
                if (!e.getCode().isTransient()) {
                    throw e;
                }
                lastException = e;
                log.warn("Classifier attempt {}/{} failed: {} {}", attempt + 1, retryPolicy.getMaxAttempts(),
                        e.getCode(), e.getMessage());
            }
        }
        throw lastException;
    }

    private ClassificationResult callOnce(ClassificationRequest request) {
        if (!rateLimiter.acquirePermission()) {
            throw new ClassifierException(AiErrorCode.AI_RATE_LIMITED, "Local classifier rate limit reached");
        }
        ClassificationResult result = webClient.post()
                .uri(CATEGORIZE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(this::authorize)
                .bodyValue(request)
                .retrieve()
                .onStatus(status -> status.value() == 429, resp -> Mono.error(
                        new ClassifierException(AiErrorCode.AI_RATE_LIMITED, "Classifier rate limited (HTTP 429)")))
                .onStatus(HttpStatusCode::isError, resp -> Mono.error(
                        new ClassifierException(AiErrorCode.AI_SERVICE_UNAVAILABLE,
                                "Classifier returned HTTP " + resp.statusCode().value())))
                .bodyToMono(ClassificationResult.class)
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new ClassifierException(AiErrorCode.AI_TIMEOUT,
                        "Classifier did not respond within " + properties.getTimeoutMs() + " ms", e))
                .onErrorMap(WebClientRequestException.class, e -> new ClassifierException(
                        AiErrorCode.AI_SERVICE_UNAVAILABLE, "Classifier unreachable: " + e.getMessage(), e))
                .onErrorMap(CodecException.class, e -> new ClassifierException(AiErrorCode.AI_INVALID_RESPONSE,
                        "Classifier response could not be read: " + e.getMessage(), e))
                .block();
        if (result == null) {
            throw new ClassifierException(AiErrorCode.AI_INVALID_RESPONSE, "Classifier returned an empty body");
        }
        return result;
    }

    private void authorize(HttpHeaders headers) {
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
    }
}
