package com.indicationscout.evidence.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Timeout, retry and rate-limit settings shared by every outbound client.
 */
@Component
@ConfigurationProperties(prefix = "scout.http")
public class HttpClientConfig {

    private long timeoutSeconds = 30;
    private int maxRetries = 3;
    private long baseDelayMillis = 1000;
    private long maxDelayMillis = 30000;
    private double backoffMultiplier = 2.0;
    private Set<Integer> retryableStatusCodes = new LinkedHashSet<>(Set.of(429, 500, 502, 503, 504));

    private int requestsPerSecond = 5;
    private int burst = 10;

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBaseDelayMillis() {
        return baseDelayMillis;
    }

    public void setBaseDelayMillis(long baseDelayMillis) {
        this.baseDelayMillis = baseDelayMillis;
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    public void setMaxDelayMillis(long maxDelayMillis) {
        this.maxDelayMillis = maxDelayMillis;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public void setRetryableStatusCodes(Set<Integer> retryableStatusCodes) {
        this.retryableStatusCodes = retryableStatusCodes;
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public void setRequestsPerSecond(int requestsPerSecond) {
        this.requestsPerSecond = requestsPerSecond;
    }

    public int getBurst() {
        return burst;
    }

    public void setBurst(int burst) {
        this.burst = burst;
    }
}
