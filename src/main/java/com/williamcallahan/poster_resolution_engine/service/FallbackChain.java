/**
 * Priority-ordered walk across poster providers
 *
 * @author William Callahan
 *
 * Features:
 * - Tries enabled providers by ascending priority, ties in registration order
 * - Skips providers the circuit breaker has taken out of rotation
 * - Treats "not found" as a reason to move on, not as a failure
 * - Records provider errors and continues; errors never escape the chain
 * - Parallel health checks and per-provider status for monitoring
 * - Runtime priority, timeout and enabled changes; the order is recomputed per fetch
 */

package com.williamcallahan.poster_resolution_engine.service;

import com.williamcallahan.poster_resolution_engine.monitoring.ResolutionMetricsRecorder;
import com.williamcallahan.poster_resolution_engine.service.provider.ProviderFetchException;
import com.williamcallahan.poster_resolution_engine.types.FallbackResult;
import com.williamcallahan.poster_resolution_engine.types.PosterProvider;
import com.williamcallahan.poster_resolution_engine.types.ProviderConfigUpdate;
import com.williamcallahan.poster_resolution_engine.types.ProviderHealth;
import com.williamcallahan.poster_resolution_engine.types.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class FallbackChain {

    private static final Logger logger = LoggerFactory.getLogger(FallbackChain.class);

    // Registration order is the priority tie-breaker
    private final List<PosterProvider> providers = new CopyOnWriteArrayList<>();
    private final ResolutionMetricsRecorder globalMetrics;
    private final Clock clock;

    public FallbackChain(ResolutionMetricsRecorder globalMetrics, Clock clock) {
        this.globalMetrics = globalMetrics;
        this.clock = clock;
    }

    /**
     * Registers a provider, replacing any existing provider with the same name in place
     */
    public synchronized void registerProvider(PosterProvider provider) {
        for (int i = 0; i < providers.size(); i++) {
            if (providers.get(i).getName().equals(provider.getName())) {
                providers.set(i, provider);
                logger.info("Poster provider {} re-registered (priority {}, enabled {})",
                        provider.getName(), provider.getPriority(), provider.isEnabled());
                return;
            }
        }
        providers.add(provider);
        logger.info("Poster provider {} registered (priority {}, enabled {})",
                provider.getName(), provider.getPriority(), provider.isEnabled());
    }

    /**
     * Resolves a poster by walking the providers in priority order
     *
     * @return future that always completes normally with a result or a sentinel
     */
    public CompletableFuture<FallbackResult> fetch(String itemId, String itemName) {
        long start = clock.millis();
        List<PosterProvider> ordered = orderedProviders();
        if (ordered.isEmpty()) {
            logger.warn("No enabled poster providers for {} ({})", itemName, itemId);
            return CompletableFuture.completedFuture(
                    FallbackResult.sentinel(FallbackResult.NO_SOURCES_AVAILABLE, clock.millis() - start));
        }
        return attempt(ordered, 0, itemId, itemName, start);
    }

    private CompletableFuture<FallbackResult> attempt(List<PosterProvider> ordered,
                                                      int index,
                                                      String itemId,
                                                      String itemName,
                                                      long start) {
        if (index >= ordered.size()) {
            logger.warn("All poster providers exhausted for {} ({})", itemName, itemId);
            return CompletableFuture.completedFuture(
                    FallbackResult.sentinel(FallbackResult.ALL_SOURCES_FAILED, clock.millis() - start));
        }

        PosterProvider provider = ordered.get(index);
        if (!provider.isAvailable()) {
            logger.debug("Skipping unavailable poster provider {}", provider.getName());
            return attempt(ordered, index + 1, itemId, itemName, start);
        }

        CompletableFuture<Optional<String>> call;
        try {
            call = provider.fetch(itemId, itemName);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((url, error) -> {
            if (error != null) {
                ProviderFetchException failure = ProviderFetchException.from(provider.getName(), error);
                logger.warn("Poster provider {} failed for {} ({}): [{}] {}", failure.getProviderName(), itemName, itemId,
                        failure.getKind().getTag(), failure.getMessage());
                globalMetrics.recordProviderFailure(provider.getName(), failure.getKind());
                return null;
            }
            if (url != null && url.isPresent()) {
                logger.debug("Poster for {} ({}) found by {}", itemName, itemId, provider.getName());
                return FallbackResult.found(url.get(), provider.getName(), clock.millis() - start);
            }
            logger.debug("Poster provider {} has no poster for {} ({})", provider.getName(), itemName, itemId);
            return null;
        }).thenCompose(result -> result != null
                ? CompletableFuture.completedFuture(result)
                : attempt(ordered, index + 1, itemId, itemName, start));
    }

    /**
     * Health-checks every registered provider in parallel
     *
     * @return health by provider name, in registration order
     */
    public CompletableFuture<Map<String, ProviderHealth>> healthCheckAll() {
        Map<String, CompletableFuture<ProviderHealth>> checks = new LinkedHashMap<>();
        for (PosterProvider provider : providers) {
            checks.put(provider.getName(), checkHealth(provider));
        }
        return CompletableFuture.allOf(checks.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, ProviderHealth> results = new LinkedHashMap<>();
                    checks.forEach((name, future) -> results.put(name, future.join()));
                    return results;
                });
    }

    private CompletableFuture<ProviderHealth> checkHealth(PosterProvider provider) {
        long start = clock.millis();
        CompletableFuture<Boolean> check;
        try {
            check = provider.healthCheck();
        } catch (RuntimeException e) {
            check = CompletableFuture.failedFuture(e);
        }
        return check.handle((healthy, error) -> {
            long latency = clock.millis() - start;
            if (error != null) {
                return new ProviderHealth(false, latency, error.getMessage(), provider.isEnabled(), false);
            }
            return new ProviderHealth(Boolean.TRUE.equals(healthy), latency, null,
                    provider.isEnabled(), provider.isAvailable());
        });
    }

    /**
     * @return status by provider name, in registration order
     */
    public Map<String, ProviderStatus> stats() {
        Map<String, ProviderStatus> stats = new LinkedHashMap<>();
        for (PosterProvider provider : providers) {
            stats.put(provider.getName(), statusOf(provider));
        }
        return stats;
    }

    public static ProviderStatus statusOf(PosterProvider provider) {
        return new ProviderStatus(provider.getName(), provider.getPriority(), provider.getTimeout().toMillis(),
                provider.isEnabled(), provider.isAvailable(), provider.getCircuitState(), provider.getMetrics());
    }

    /**
     * Logs configured providers that have no registered implementation
     *
     * @return names configured but not registered
     */
    public List<String> validateProviders(Collection<String> configuredNames) {
        List<String> registered = providers.stream().map(PosterProvider::getName).collect(Collectors.toList());
        List<String> missing = new ArrayList<>();
        for (String name : configuredNames) {
            if (!registered.contains(name)) {
                missing.add(name);
                logger.warn("Configured poster provider '{}' is not registered (registered: {})", name, registered);
            }
        }
        logger.info("{} poster providers validated: {}", registered.size(), registered);
        return missing;
    }

    public Optional<PosterProvider> getProvider(String name) {
        return providers.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public List<PosterProvider> getProviders() {
        return List.copyOf(providers);
    }

    public boolean setProviderEnabled(String name, boolean enabled) {
        Optional<PosterProvider> provider = getProvider(name);
        provider.ifPresent(p -> p.setEnabled(enabled));
        return provider.isPresent();
    }

    /**
     * Applies a partial configuration change to one provider. Unset fields keep their current value.
     *
     * @return the updated provider, or empty if no provider has that name
     * @throws IllegalArgumentException if the update is empty or out of range
     */
    public Optional<PosterProvider> updateProviderConfig(String name, ProviderConfigUpdate update) {
        Optional<PosterProvider> provider = getProvider(name);
        provider.ifPresent(p -> p.applyConfig(update));
        return provider;
    }

    public void resetMetrics() {
        providers.forEach(PosterProvider::resetMetrics);
    }

    public void shutdown() {
        logger.info("Shutting down fallback chain with {} providers", providers.size());
        providers.clear();
    }

    List<PosterProvider> orderedProviders() {
        // List.sort is stable, so equal priorities keep registration order
        List<PosterProvider> ordered = providers.stream()
                .filter(PosterProvider::isEnabled)
                .collect(Collectors.toCollection(ArrayList::new));
        ordered.sort(Comparator.comparingInt(PosterProvider::getPriority));
        return ordered;
    }
}
