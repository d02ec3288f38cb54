package com.indicationscout.evidence.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * An in-process cache entry.
 */
record CacheEntry(String namespace, Map<String, ?> params, Object payload, Instant cachedAt, Duration ttl) {

    boolean isExpired(Instant now) {
        return now.isAfter(cachedAt.plus(ttl));
    }
}
