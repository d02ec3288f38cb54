package com.indicationscout.evidence.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.indicationscout.evidence.infrastructure.config.CacheConfig;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Hands each client its own cache instance over the shared durable store.
 */
@Component
public class TwoTierCacheFactory {

    private final DurableCacheStore durableStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CacheConfig config;

    public TwoTierCacheFactory(DurableCacheStore durableStore, ObjectMapper objectMapper,
                               Clock clock, CacheConfig config) {
        this.durableStore = durableStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = config;
    }

    public TwoTierCache create(String owner) {
        return new TwoTierCache(owner, durableStore, objectMapper, clock, config.getTtl());
    }
}
