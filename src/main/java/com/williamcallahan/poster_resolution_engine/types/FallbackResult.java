package com.williamcallahan.poster_resolution_engine.types;

/**
 * Outcome of a single poster resolution
 *
 * @author William Callahan
 *
 * Features:
 * - {@code url} is null when nothing was resolved
 * - {@code sourceName} carries the provider name or one of the sentinel values
 */
public record FallbackResult(String url, String sourceName, boolean fromCache, long elapsedMs) {

    public static final String NO_SOURCES_AVAILABLE = "no_sources_available";
    public static final String ALL_SOURCES_FAILED = "all_sources_failed";
    public static final String ERROR = "error";

    public static FallbackResult found(String url, String sourceName, long elapsedMs) {
        return new FallbackResult(url, sourceName, false, elapsedMs);
    }

    public static FallbackResult cached(CacheEntry entry, long elapsedMs) {
        return new FallbackResult(entry.resultUrl(), entry.sourceName(), true, elapsedMs);
    }

    public static FallbackResult sentinel(String sentinel, long elapsedMs) {
        return new FallbackResult(null, sentinel, false, elapsedMs);
    }

    public boolean hasUrl() {
        return url != null && !url.isEmpty();
    }
}
