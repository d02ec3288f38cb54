package com.indicationscout.evidence.infrastructure.http;

import com.indicationscout.evidence.infrastructure.config.HttpClientConfig;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable per-client request policy.
 *
 * @param maxRetries retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param maxDelay   cap applied to every backoff delay
 */
public record RequestConfig(
        Duration timeout,
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        Set<Integer> retryableStatusCodes,
        int requestsPerSecond,
        int burst
) {
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    public RequestConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1: " + backoffMultiplier);
        }
        if (baseDelay.isNegative() || baseDelay.isZero() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 < baseDelay <= maxDelay");
        }
        if (requestsPerSecond <= 0 || burst <= 0) {
            throw new IllegalArgumentException("rate limit must be positive");
        }
        retryableStatusCodes = Set.copyOf(retryableStatusCodes);
    }

    public static RequestConfig defaults() {
        return new RequestConfig(Duration.ofSeconds(30), 3, Duration.ofSeconds(1), Duration.ofSeconds(30),
                2.0, DEFAULT_RETRYABLE_STATUS_CODES, 5, 10);
    }

    public static RequestConfig from(HttpClientConfig config) {
        return new RequestConfig(
                Duration.ofSeconds(config.getTimeoutSeconds()),
                config.getMaxRetries(),
                Duration.ofMillis(config.getBaseDelayMillis()),
                Duration.ofMillis(config.getMaxDelayMillis()),
                config.getBackoffMultiplier(),
                config.getRetryableStatusCodes(),
                config.getRequestsPerSecond(),
                config.getBurst());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public boolean isRetryable(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    /**
     * Delay before retry number {@code retry} (1-based):
     * {@code min(baseDelay * multiplier^(retry-1), maxDelay)}.
     */
    public Duration delayBeforeRetry(int retry) {
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, retry - 1);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis((long) millis);
    }

    /**
     * Refresh period of the permit budget: {@code burst} permits every
     * {@code burst / requestsPerSecond} seconds.
     */
    public Duration rateLimitRefreshPeriod() {
        return Duration.ofMillis(Math.max(1L, 1000L * burst / requestsPerSecond));
    }
}
