package com.indicationscout.evidence.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration for the two-tier response cache.
 * The durable tier is on unless explicitly switched off.
 */
@Component
@ConfigurationProperties(prefix = "scout.cache")
public class CacheConfig {

    private int ttlDays = 5;
    private String keyPrefix = "scout:cache:";
    private boolean persistenceEnabled = true;

    public int getTtlDays() {
        return ttlDays;
    }

    public void setTtlDays(int ttlDays) {
        this.ttlDays = ttlDays;
    }

    public Duration getTtl() {
        return Duration.ofDays(ttlDays);
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public boolean isPersistenceEnabled() {
        return persistenceEnabled;
    }

    public void setPersistenceEnabled(boolean persistenceEnabled) {
        this.persistenceEnabled = persistenceEnabled;
    }
}
