package com.williamcallahan.poster_resolution_engine.types;

/**
 * Provider metrics joined with its configuration and circuit state
 *
 * @author William Callahan
 */
public record ProviderStatus(String name,
                             int priority,
                             long timeoutMs,
                             boolean enabled,
                             boolean available,
                             CircuitState circuitState,
                             ProviderMetrics metrics) {
}
