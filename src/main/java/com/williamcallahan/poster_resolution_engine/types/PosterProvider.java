package com.williamcallahan.poster_resolution_engine.types;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Managed poster provider as seen by the fallback chain
 *
 * @author William Callahan
 *
 * Features:
 * - Priority ordering and enable/disable switch
 * - Availability combines the enabled flag with circuit breaker state
 * - Per-provider metrics and administrative circuit overrides
 */
public interface PosterProvider {

    String getName();

    /**
     * @return ordering key; lower values are tried first
     */
    int getPriority();

    /**
     * @return the time allowed for a single attempt
     */
    Duration getTimeout();

    /**
     * Applies a runtime configuration change; unset fields keep their current value
     */
    void applyConfig(ProviderConfigUpdate update);

    /**
     * Attempts a lookup
     *
     * @return future with the URL, empty for "not found"; fails with
     *         {@code ProviderFetchException} on unavailability, timeout or transport failure
     */
    CompletableFuture<Optional<String>> fetch(String itemId, String itemName);

    CompletableFuture<Boolean> healthCheck();

    ProviderMetrics getMetrics();

    void resetMetrics();

    void setEnabled(boolean enabled);

    boolean isEnabled();

    /**
     * @return true when enabled and not temporarily disabled by the circuit breaker
     */
    boolean isAvailable();

    CircuitState getCircuitState();

    void forceOpen();

    void forceClose();
}
