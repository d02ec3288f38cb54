package com.indicationscout.evidence.infrastructure.cache;

/**
 * Cache performance metrics
 */
public record CacheStats(
        long hits,
        long misses,
        long expired,
        long corrupt,
        int activeEntries
) {
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, Active entries: %d, Expired: %d, Corrupt: %d",
                hitRatio() * 100, activeEntries, expired, corrupt);
    }
}
