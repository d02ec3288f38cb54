package com.indicationscout.evidence.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage shared across processes, addressed by content hash.
 * Overwriting a key with the same content is idempotent, so no locking is
 * needed between concurrent writers.
 */
public interface DurableCacheStore {

    Optional<String> read(String key);

    void write(String key, String envelope, Duration ttl);

    void delete(String key);

    boolean isEnabled();

    /**
     * A store that keeps nothing. Only used when persistence is switched off
     * in configuration.
     */
    static DurableCacheStore disabled() {
        return Disabled.INSTANCE;
    }

    enum Disabled implements DurableCacheStore {
        INSTANCE;

        @Override
        public Optional<String> read(String key) {
            return Optional.empty();
        }

        @Override
        public void write(String key, String envelope, Duration ttl) {
        }

        @Override
        public void delete(String key) {
        }

        @Override
        public boolean isEnabled() {
            return false;
        }
    }
}
