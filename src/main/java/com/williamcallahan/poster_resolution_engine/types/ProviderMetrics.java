package com.williamcallahan.poster_resolution_engine.types;

import java.time.Instant;

/**
 * Point-in-time snapshot of a provider's request statistics
 *
 * @author William Callahan
 */
public record ProviderMetrics(long totalRequests,
                              long successfulRequests,
                              long failedRequests,
                              int consecutiveFailures,
                              double averageResponseTimeMs,
                              String lastError,
                              Instant lastSuccessAt,
                              boolean temporarilyDisabled) {

    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
    }
}
