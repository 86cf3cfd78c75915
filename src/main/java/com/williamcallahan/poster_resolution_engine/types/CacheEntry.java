package com.williamcallahan.poster_resolution_engine.types;

/**
 * Cached resolution result
 *
 * @author William Callahan
 *
 * Features:
 * - Absolute expiry is {@code createdAtEpochMs + ttlMs}
 * - Immutable; a hit produces a copy with an incremented hit count
 */
public record CacheEntry(String key,
                         String resultUrl,
                         String sourceName,
                         long createdAtEpochMs,
                         long ttlMs,
                         long hitCount) {

    public static CacheEntry of(String key, String resultUrl, String sourceName, long createdAtEpochMs, long ttlMs) {
        return new CacheEntry(key, resultUrl, sourceName, createdAtEpochMs, ttlMs, 0L);
    }

    public long expiresAtEpochMs() {
        return createdAtEpochMs + ttlMs;
    }

    public boolean isExpired(long nowEpochMs) {
        return nowEpochMs >= expiresAtEpochMs();
    }

    public CacheEntry withHit() {
        return new CacheEntry(key, resultUrl, sourceName, createdAtEpochMs, ttlMs, hitCount + 1);
    }
}
