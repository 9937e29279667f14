package org.carball.router.cache;

/**
 * Point-in-time counters of the result cache.
 */
public record ResultCacheStats(
        long size,
        long capacity,
        long hits,
        long misses,
        long evictions,
        long expirations,
        long corruptEntriesDropped,
        long computations
) {

    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
