package com.indicationscout.evidence.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Namespaced cache with an in-process tier owned by one client instance and
 * a durable tier shared across processes.
 *
 * <p>Reads check the in-process tier, then the durable tier, promoting a
 * durable hit. An entry older than its TTL, or one that no longer
 * deserializes, is a miss; the stale durable copy is deleted. Nothing here
 * throws on a bad entry.
 */
public class TwoTierCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TwoTierCache.class);

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final String owner;
    private final Map<String, CacheEntry> memory = new ConcurrentHashMap<>();
    private final DurableCacheStore durableStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultTtl;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong corrupt = new AtomicLong();

    public TwoTierCache(String owner, DurableCacheStore durableStore, ObjectMapper objectMapper,
                        Clock clock, Duration defaultTtl) {
        this.owner = owner;
        this.durableStore = durableStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public <T> Optional<T> get(String namespace, Map<String, ?> params, Class<T> type) {
        String key = CacheKeys.keyFor(namespace, params);
        Instant now = clock.instant();

        Optional<T> fromMemory = readMemory(key, namespace, type, now);
        if (fromMemory.isPresent()) {
            hits.incrementAndGet();
            logger.debug("[{}] Memory hit for {} {}", owner, namespace, params);
            return fromMemory;
        }

        Optional<T> fromStore = readDurable(key, namespace, params, type, now);
        if (fromStore.isPresent()) {
            hits.incrementAndGet();
            logger.debug("[{}] Durable hit for {} {}", owner, namespace, params);
            return fromStore;
        }

        misses.incrementAndGet();
        logger.debug("[{}] Cache miss for {} {}", owner, namespace, params);
        return Optional.empty();
    }

    public void set(String namespace, Map<String, ?> params, Object value) {
        set(namespace, params, value, defaultTtl);
    }

    public void set(String namespace, Map<String, ?> params, Object value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        String key = CacheKeys.keyFor(namespace, params);
        Instant now = clock.instant();
        memory.put(key, new CacheEntry(namespace, params, value, now, ttl));

        if (!durableStore.isEnabled()) {
            return;
        }
        try {
            StoredCacheEntry envelope = new StoredCacheEntry(namespace,
                    objectMapper.convertValue(params, PARAMS_TYPE),
                    objectMapper.valueToTree(value), now, Math.max(1L, ttl.toSeconds()));
            durableStore.write(key, objectMapper.writeValueAsString(envelope), ttl);
            logger.debug("[{}] Stored {} {} (TTL: {})", owner, namespace, params, ttl);
        } catch (Exception e) {
            logger.warn("[{}] Could not serialize {} entry for durable tier: {}", owner, namespace, e.getMessage());
        }
    }

    public void invalidate(String namespace, Map<String, ?> params) {
        String key = CacheKeys.keyFor(namespace, params);
        memory.remove(key);
        durableStore.delete(key);
    }

    /**
     * Drops the in-process tier. The durable tier is left untouched.
     */
    public void clear() {
        memory.clear();
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), expired.get(), corrupt.get(), memory.size());
    }

    @Override
    public void close() {
        logger.debug("[{}] Closing cache: {}", owner, getStats().summary());
        clear();
    }

    private <T> Optional<T> readMemory(String key, String namespace, Class<T> type, Instant now) {
        CacheEntry entry = memory.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            expired.incrementAndGet();
            memory.remove(key, entry);
            return Optional.empty();
        }
        if (type.isInstance(entry.payload())) {
            return Optional.of(type.cast(entry.payload()));
        }
        try {
            return Optional.of(objectMapper.convertValue(entry.payload(), type));
        } catch (IllegalArgumentException e) {
            corrupt.incrementAndGet();
            logger.warn("[{}] Discarding memory entry for {}: {}", owner, namespace, e.getMessage());
            memory.remove(key, entry);
            return Optional.empty();
        }
    }

    private <T> Optional<T> readDurable(String key, String namespace, Map<String, ?> params,
                                        Class<T> type, Instant now) {
        Optional<String> raw = durableStore.read(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        StoredCacheEntry envelope;
        T value;
        try {
            envelope = objectMapper.readValue(raw.get(), StoredCacheEntry.class);
            if (!envelope.isComplete()) {
                throw new IllegalStateException("incomplete envelope");
            }
            if (envelope.isExpired(now)) {
                expired.incrementAndGet();
                logger.debug("[{}] Cache expired for {} (written {})", owner, namespace, envelope.cachedAt());
                durableStore.delete(key);
                return Optional.empty();
            }
            value = objectMapper.treeToValue(envelope.payload(), type);
            if (value == null) {
                throw new IllegalStateException("null payload");
            }
        } catch (Exception e) {
            corrupt.incrementAndGet();
            logger.warn("[{}] Corrupt cache entry for {}, deleting: {}", owner, namespace, e.getMessage());
            durableStore.delete(key);
            return Optional.empty();
        }

        memory.put(key, new CacheEntry(namespace, params, value, envelope.cachedAt(),
                Duration.ofSeconds(envelope.ttlSeconds())));
        return Optional.of(value);
    }
}
