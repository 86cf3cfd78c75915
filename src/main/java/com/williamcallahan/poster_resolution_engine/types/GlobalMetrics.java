package com.williamcallahan.poster_resolution_engine.types;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate resolution counters owned by the resolution manager
 *
 * @author William Callahan
 *
 * Features:
 * - Totals, cache hit/miss and a rolling average response time
 * - Per-source success/failure tallies and per-error-kind tallies
 * - {@code startedAt} marks the last reset so snapshots stay stable between mutations
 */
public record GlobalMetrics(long totalRequests,
                            long successfulRequests,
                            long failedRequests,
                            long cacheHits,
                            long cacheMisses,
                            double averageResponseTimeMs,
                            Map<String, SourceUsage> sourceUsage,
                            Map<String, Long> errorKinds,
                            Instant startedAt) {

    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
    }

    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
    }

    public record SourceUsage(long success, long failure) {
    }
}
