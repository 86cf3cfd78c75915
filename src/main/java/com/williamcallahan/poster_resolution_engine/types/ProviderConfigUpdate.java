package com.williamcallahan.poster_resolution_engine.types;

import java.time.Duration;

/**
 * Runtime change to a provider's configuration; null fields are left unchanged
 *
 * @author William Callahan
 */
public record ProviderConfigUpdate(Integer priority, Long timeoutMs, Boolean enabled) {

    /**
     * @throws IllegalArgumentException when no field is set or a value is out of range
     */
    public void validate() {
        if (priority == null && timeoutMs == null && enabled == null) {
            throw new IllegalArgumentException("At least one of priority, timeoutMs or enabled is required");
        }
        if (priority != null && priority < 0) {
            throw new IllegalArgumentException("priority must not be negative");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }

    public Duration timeout() {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
