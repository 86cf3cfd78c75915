package com.williamcallahan.poster_resolution_engine.types;

import java.util.Map;

/**
 * Aggregated view of cache, provider and global statistics plus the active configuration
 *
 * @author William Callahan
 */
public record ResolutionStats(CacheStats cache,
                              Map<String, ProviderStatus> providers,
                              GlobalMetrics global,
                              EngineConfig config) {

    public record EngineConfig(long cacheTtlMs, int cacheMaxSize, boolean cachePersisted, int providerCount) {
    }
}
