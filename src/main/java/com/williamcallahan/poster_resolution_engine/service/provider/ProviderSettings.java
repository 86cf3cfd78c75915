package com.williamcallahan.poster_resolution_engine.service.provider;

import com.williamcallahan.poster_resolution_engine.config.PosterResolutionProperties;

import java.time.Duration;

/**
 * Resolved execution settings for one provider
 *
 * @author William Callahan
 */
public record ProviderSettings(String name,
                               boolean enabled,
                               int priority,
                               Duration timeout,
                               int rateLimitRequests,
                               Duration rateLimitWindow,
                               Duration rateLimitMargin,
                               int failureThreshold,
                               Duration cooldown) {

    /**
     * Merges a provider entry with the global circuit breaker defaults
     */
    public static ProviderSettings from(String name, PosterResolutionProperties properties) {
        PosterResolutionProperties.Provider provider = properties.getProviders().get(name);
        if (provider == null) {
            throw new IllegalArgumentException("No configuration for poster provider '" + name + "'");
        }
        PosterResolutionProperties.CircuitBreaker defaults = properties.getCircuitBreaker();
        PosterResolutionProperties.CircuitBreakerOverride override = provider.getCircuitBreaker();
        int threshold = override != null && override.getFailureThreshold() != null
                ? override.getFailureThreshold()
                : defaults.getFailureThreshold();
        Duration cooldown = override != null && override.getCooldown() != null
                ? override.getCooldown()
                : defaults.getCooldown();
        return new ProviderSettings(
                name,
                provider.isEnabled(),
                provider.getPriority(),
                provider.getTimeout(),
                provider.getRateLimit().getRequests(),
                provider.getRateLimit().getWindow(),
                properties.getRateLimitMargin(),
                threshold,
                cooldown
        );
    }

    public ProviderSettings withEnabled(boolean value) {
        return new ProviderSettings(name, value, priority, timeout, rateLimitRequests, rateLimitWindow,
                rateLimitMargin, failureThreshold, cooldown);
    }

    public ProviderSettings withPriority(int value) {
        return new ProviderSettings(name, enabled, value, timeout, rateLimitRequests, rateLimitWindow,
                rateLimitMargin, failureThreshold, cooldown);
    }

    public ProviderSettings withTimeout(Duration value) {
        return new ProviderSettings(name, enabled, priority, value, rateLimitRequests, rateLimitWindow,
                rateLimitMargin, failureThreshold, cooldown);
    }
}
