/**
 * Poster resolution configuration properties
 * Centralizes all app.poster.* properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.poster_resolution_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "app.poster")
public class PosterResolutionProperties {

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Duration rateLimitMargin = Duration.ofMillis(10);

    private Map<String, Provider> providers = new LinkedHashMap<>();

    // Getters and setters
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public Duration getRateLimitMargin() { return rateLimitMargin; }
    public void setRateLimitMargin(Duration rateLimitMargin) { this.rateLimitMargin = rateLimitMargin; }

    public Map<String, Provider> getProviders() { return providers; }
    public void setProviders(Map<String, Provider> providers) { this.providers = providers; }

    public static class Cache {
        private Duration ttl = Duration.ofHours(24);
        private int maxSize = 1000;
        private boolean persist = false;
        private String filePath = "./cache/posters.json";
        private Duration persistDebounce = Duration.ofSeconds(1);
        private Duration cleanupInterval = Duration.ofMinutes(10);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public boolean isPersist() { return persist; }
        public void setPersist(boolean persist) { this.persist = persist; }

        public String getFilePath() { return filePath; }
        public void setFilePath(String filePath) { this.filePath = filePath; }

        public Duration getPersistDebounce() { return persistDebounce; }
        public void setPersistDebounce(Duration persistDebounce) { this.persistDebounce = persistDebounce; }

        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 10;
        private Duration cooldown = Duration.ofMinutes(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    }

    public static class RateLimit {
        private int requests = 30;
        private Duration window = Duration.ofSeconds(60);

        public int getRequests() { return requests; }
        public void setRequests(int requests) { this.requests = requests; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class Provider {
        private boolean enabled = true;
        private int priority = 100;
        private Duration timeout = Duration.ofSeconds(3);
        private String baseUrl;
        private String apiKey;

        @NestedConfigurationProperty
        private RateLimit rateLimit = new RateLimit();

        // Unset fields fall back to app.poster.circuit-breaker
        @NestedConfigurationProperty
        private CircuitBreakerOverride circuitBreaker = new CircuitBreakerOverride();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public RateLimit getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

        public CircuitBreakerOverride getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerOverride circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    }

    public static class CircuitBreakerOverride {
        private Integer failureThreshold;
        private Duration cooldown;

        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    }
}
