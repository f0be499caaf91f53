package com.lodestar.core.cache;

/**
 * Point-in-time counters of a {@link ContextCache}.
 */
public record CacheStatistics(
    long hits,
    long misses,
    long evictions,
    long invalidations,
    int size
) {

    public long requests() {
        return hits + misses;
    }

    public double hitRatio() {
        long requests = requests();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
