package com.williamcallahan.poster_resolution_engine.types;

/**
 * Result of probing a single provider
 *
 * @author William Callahan
 */
public record ProviderHealth(boolean healthy, long latencyMs, String error, boolean enabled, boolean available) {
}
