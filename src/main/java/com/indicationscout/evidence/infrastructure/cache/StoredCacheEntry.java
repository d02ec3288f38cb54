package com.indicationscout.evidence.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * JSON envelope written to the durable tier: the payload plus the write time
 * and the TTL in effect when it was written.
 */
public record StoredCacheEntry(
        String namespace,
        Map<String, Object> params,
        JsonNode payload,
        Instant cachedAt,
        long ttlSeconds
) {
    boolean isComplete() {
        return payload != null && cachedAt != null && ttlSeconds > 0;
    }

    boolean isExpired(Instant now) {
        return now.isAfter(cachedAt.plusSeconds(ttlSeconds));
    }
}
