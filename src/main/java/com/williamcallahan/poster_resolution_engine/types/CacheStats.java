package com.williamcallahan.poster_resolution_engine.types;

/**
 * Cache counters; {@code hitRate} is hits over total lookups, 0 when idle
 *
 * @author William Callahan
 */
public record CacheStats(long hits, long misses, long sets, long evictions, int size, int maxSize, double hitRate) {
}
