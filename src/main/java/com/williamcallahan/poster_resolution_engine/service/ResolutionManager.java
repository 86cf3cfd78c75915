/**
 * Public entry point for poster resolution
 *
 * @author William Callahan
 *
 * Features:
 * - Serves cached results and stores newly resolved ones with the default TTL
 * - Coalesces concurrent lookups of the same item into one provider walk
 * - Never fails: internal errors become an "error" sentinel result
 * - Owns the global metrics and the cache/chain lifecycle
 * - Administrative operations for cache, metrics and provider control
 * - Refuses to resolve once shut down
 */

package com.williamcallahan.poster_resolution_engine.service;

import com.williamcallahan.poster_resolution_engine.monitoring.ResolutionMetricsRecorder;
import com.williamcallahan.poster_resolution_engine.service.cache.PosterCache;
import com.williamcallahan.poster_resolution_engine.types.CacheEntry;
import com.williamcallahan.poster_resolution_engine.types.FallbackResult;
import com.williamcallahan.poster_resolution_engine.types.PosterProvider;
import com.williamcallahan.poster_resolution_engine.types.ProviderConfigUpdate;
import com.williamcallahan.poster_resolution_engine.types.ProviderHealth;
import com.williamcallahan.poster_resolution_engine.types.ProviderStatus;
import com.williamcallahan.poster_resolution_engine.types.ResolutionKey;
import com.williamcallahan.poster_resolution_engine.types.ResolutionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class ResolutionManager {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionManager.class);

    private final PosterCache cache;
    private final FallbackChain fallbackChain;
    private final ResolutionMetricsRecorder metrics;
    private final Collection<String> configuredProviders;
    private final Clock clock;

    private final ConcurrentMap<String, CompletableFuture<FallbackResult>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public ResolutionManager(PosterCache cache,
                             FallbackChain fallbackChain,
                             ResolutionMetricsRecorder metrics,
                             Collection<String> configuredProviders,
                             Clock clock) {
        this.cache = cache;
        this.fallbackChain = fallbackChain;
        this.metrics = metrics;
        this.configuredProviders = List.copyOf(configuredProviders);
        this.clock = clock;
    }

    /**
     * Restores the persisted cache and checks configured providers against registered ones.
     * Safe to call more than once. Does nothing after {@link #shutdown()}.
     */
    public void initialize() {
        if (shutDown.get()) {
            logger.warn("Poster resolution manager is shut down; ignoring initialize");
            return;
        }
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        cache.initialize();
        fallbackChain.validateProviders(configuredProviders);
        logger.info("Poster resolution manager initialized (cache size {}, {} providers)",
                cache.size(), fallbackChain.getProviders().size());
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Resolves a poster URL for an item
     *
     * @param itemId catalog identifier
     * @param itemName display name used by title-search providers
     * @return future that always completes normally; an "error" sentinel once shut down
     */
    public CompletableFuture<FallbackResult> resolve(String itemId, String itemName) {
        long start = clock.millis();
        ResolutionKey key;
        try {
            if (shutDown.get()) {
                throw new IllegalStateException("Poster resolution manager is shut down");
            }
            ensureInitialized();
            key = new ResolutionKey(itemId, itemName);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(errorResult(e, start));
        }

        CompletableFuture<FallbackResult> created = new CompletableFuture<>();
        CompletableFuture<FallbackResult> existing = inFlight.putIfAbsent(key.value(), created);
        if (existing != null) {
            logger.debug("Joining in-flight poster resolution for {}", key);
            return existing.copy();
        }

        resolveUncoalesced(key, start).whenComplete((result, error) -> {
            // Removed before completion so callers reacting to the result start a fresh lookup
            inFlight.remove(key.value(), created);
            if (error != null) {
                created.complete(errorResult(error, start));
            } else {
                created.complete(result);
            }
        });
        return created.copy();
    }

    /**
     * Reactive form of {@link #resolve(String, String)}
     */
    public Mono<FallbackResult> resolveReactive(String itemId, String itemName) {
        return Mono.fromFuture(() -> resolve(itemId, itemName));
    }

    private CompletableFuture<FallbackResult> resolveUncoalesced(ResolutionKey key, long start) {
        try {
            Optional<CacheEntry> cached = cache.get(key.value());
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                logger.debug("Poster cache HIT for {} (source {})", key, cached.get().sourceName());
                return CompletableFuture.completedFuture(FallbackResult.cached(cached.get(), clock.millis() - start));
            }
            metrics.recordCacheMiss();
            logger.debug("Poster cache MISS for {}", key);

            return fallbackChain.fetch(key.itemId(), key.itemName()).thenApply(chainResult -> {
                long elapsed = clock.millis() - start;
                if (chainResult.hasUrl()) {
                    cache.put(key.value(), chainResult.url(), chainResult.sourceName());
                    metrics.recordSuccess(chainResult.sourceName(), elapsed);
                    logger.info("Poster for {} resolved by {} in {}ms", key.itemName(), chainResult.sourceName(), elapsed);
                    return FallbackResult.found(chainResult.url(), chainResult.sourceName(), elapsed);
                }
                metrics.recordFailure(chainResult.sourceName(), elapsed);
                logger.warn("No poster found for {} ({}) after {}ms: {}", key.itemName(), key.itemId(), elapsed,
                        chainResult.sourceName());
                return FallbackResult.sentinel(chainResult.sourceName(), elapsed);
            });
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private FallbackResult errorResult(Throwable error, long start) {
        long elapsed = clock.millis() - start;
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        metrics.recordError(cause, elapsed);
        logger.error("Poster resolution failed unexpectedly", cause);
        return FallbackResult.sentinel(FallbackResult.ERROR, elapsed);
    }

    private void ensureInitialized() {
        if (!initialized.get()) {
            initialize();
        }
    }

    /**
     * Removes the cached result for one item
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String itemId, String itemName) {
        return cache.invalidate(new ResolutionKey(itemId, itemName).value());
    }

    public void clearCache() {
        cache.clear();
        logger.info("Poster cache cleared");
    }

    /**
     * @return number of expired entries removed
     */
    public int cleanupCache() {
        int removed = cache.cleanup();
        if (removed > 0) {
            logger.info("Poster cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * Resets every provider's metrics and circuit, then the global metrics
     */
    public void resetMetrics() {
        fallbackChain.resetMetrics();
        metrics.reset();
        logger.info("Poster provider and global metrics reset");
    }

    public boolean setProviderEnabled(String name, boolean enabled) {
        boolean found = fallbackChain.setProviderEnabled(name, enabled);
        if (!found) {
            logger.warn("Cannot {} unknown poster provider '{}'", enabled ? "enable" : "disable", name);
        }
        return found;
    }

    /**
     * Changes priority, timeout or enabled flag of one provider while running
     *
     * @return the provider's status after the change, or empty if the name is unknown
     * @throws IllegalArgumentException if the update is empty or out of range
     */
    public Optional<ProviderStatus> updateProviderConfig(String name, ProviderConfigUpdate update) {
        Optional<ProviderStatus> status = fallbackChain.updateProviderConfig(name, update)
                .map(FallbackChain::statusOf);
        if (status.isEmpty()) {
            logger.warn("Cannot reconfigure unknown poster provider '{}'", name);
        }
        return status;
    }

    public boolean forceOpenProvider(String name) {
        Optional<PosterProvider> provider = fallbackChain.getProvider(name);
        provider.ifPresent(PosterProvider::forceOpen);
        return provider.isPresent();
    }

    public boolean forceCloseProvider(String name) {
        Optional<PosterProvider> provider = fallbackChain.getProvider(name);
        provider.ifPresent(PosterProvider::forceClose);
        return provider.isPresent();
    }

    /**
     * Brings providers taken out of rotation by their circuit back into service
     *
     * @return names of the reactivated providers
     */
    public List<String> reactivateDisabledProviders() {
        List<String> reactivated = new ArrayList<>();
        for (PosterProvider provider : fallbackChain.getProviders()) {
            if (provider.getMetrics().temporarilyDisabled()) {
                provider.setEnabled(true);
                provider.resetMetrics();
                reactivated.add(provider.getName());
            }
        }
        if (!reactivated.isEmpty()) {
            logger.info("Reactivated poster providers: {}", reactivated);
        }
        return reactivated;
    }

    public CompletableFuture<Map<String, ProviderHealth>> healthCheckAll() {
        return fallbackChain.healthCheckAll();
    }

    public Optional<PosterProvider> getProvider(String name) {
        return fallbackChain.getProvider(name);
    }

    public ResolutionStats getStats() {
        return new ResolutionStats(
                cache.stats(),
                fallbackChain.stats(),
                metrics.snapshot(),
                new ResolutionStats.EngineConfig(cache.getDefaultTtlMs(), cache.getMaxSize(), cache.isPersistent(),
                        fallbackChain.getProviders().size()));
    }

    public ResolutionMetricsRecorder getMetrics() {
        return metrics;
    }

    int inFlightCount() {
        return inFlight.size();
    }

    public boolean isShutDown() {
        return shutDown.get();
    }

    /**
     * Flushes the cache to disk and releases providers. Later resolutions return the "error" sentinel.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down poster resolution manager after {}", metrics.uptime());
        cache.shutdown();
        fallbackChain.shutdown();
        initialized.set(false);
    }
}
