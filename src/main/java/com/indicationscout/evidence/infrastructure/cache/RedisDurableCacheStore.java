package com.indicationscout.evidence.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable tier on Redis. Store failures are logged and reported as a miss or
 * a skipped write; they never reach the caller.
 */
public class RedisDurableCacheStore implements DurableCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisDurableCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisDurableCacheStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<String> read(String key) {
        try {
            String envelope = redisTemplate.opsForValue().get(redisKey(key));
            return envelope == null || envelope.isEmpty() ? Optional.empty() : Optional.of(envelope);
        } catch (Exception e) {
            logger.warn("Failed to read cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(String key, String envelope, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(redisKey(key), envelope, ttl);
        } catch (Exception e) {
            logger.warn("Failed to write cache entry {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(redisKey(key));
        } catch (Exception e) {
            logger.warn("Failed to delete cache entry {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private String redisKey(String key) {
        return keyPrefix + key; // e.g. "scout:cache:3f2a..."
    }
}
