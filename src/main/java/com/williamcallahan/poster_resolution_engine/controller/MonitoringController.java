/**
 * REST Controller for poster resolution monitoring and maintenance
 *
 * @author William Callahan
 *
 * Features:
 * - Exposes global, provider, cache, error and performance statistics
 * - Runs health checks across all providers
 * - Clears or purges the cache and resets metrics
 * - Enables, disables, reconfigures and overrides provider circuits by name
 */

package com.williamcallahan.poster_resolution_engine.controller;

import com.williamcallahan.poster_resolution_engine.service.FallbackChain;
import com.williamcallahan.poster_resolution_engine.service.ResolutionManager;
import com.williamcallahan.poster_resolution_engine.types.CacheStats;
import com.williamcallahan.poster_resolution_engine.types.GlobalMetrics;
import com.williamcallahan.poster_resolution_engine.types.ProviderConfigUpdate;
import com.williamcallahan.poster_resolution_engine.types.ProviderHealth;
import com.williamcallahan.poster_resolution_engine.types.ProviderMetrics;
import com.williamcallahan.poster_resolution_engine.types.ProviderStatus;
import com.williamcallahan.poster_resolution_engine.types.ResolutionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/admin/posters")
public class MonitoringController {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringController.class);

    private final ResolutionManager resolutionManager;

    public MonitoringController(ResolutionManager resolutionManager) {
        this.resolutionManager = resolutionManager;
    }

    @GetMapping("/stats")
    public ResponseEntity<ResolutionStats> stats() {
        return ResponseEntity.ok(resolutionManager.getStats());
    }

    @GetMapping("/stats/providers")
    public ResponseEntity<Map<String, ProviderStatus>> providerStats() {
        return ResponseEntity.ok(resolutionManager.getStats().providers());
    }

    /**
     * Gets the status of a single provider
     *
     * @param name provider name
     * @return the provider status, or 404 when no provider has that name
     */
    @GetMapping("/stats/providers/{name}")
    public ResponseEntity<ProviderStatus> providerStats(@PathVariable("name") String name) {
        return resolutionManager.getProvider(name)
            .map(FallbackChain::statusOf)
            .map(ResponseEntity::ok)
            .orElseGet(() -> {
                logger.warn("Stats requested for unknown poster provider '{}'", name);
                return ResponseEntity.notFound().build();
            });
    }

    @GetMapping("/stats/cache")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(resolutionManager.getStats().cache());
    }

    @GetMapping("/stats/errors")
    public ResponseEntity<Map<String, Object>> errorStats() {
        GlobalMetrics global = resolutionManager.getStats().global();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalRequests", global.totalRequests());
        body.put("failedRequests", global.failedRequests());
        body.put("errorKinds", global.errorKinds());
        return ResponseEntity.ok(body);
    }

    /**
     * Condensed performance view for dashboards
     *
     * @return global rates, per-provider response times and availability, cache occupancy
     */
    @GetMapping("/stats/performance")
    public ResponseEntity<Map<String, Object>> performanceStats() {
        ResolutionStats stats = resolutionManager.getStats();
        GlobalMetrics global = stats.global();

        Map<String, Object> globalBody = new LinkedHashMap<>();
        globalBody.put("totalRequests", global.totalRequests());
        globalBody.put("successRate", global.successRate());
        globalBody.put("averageResponseTimeMs", global.averageResponseTimeMs());
        globalBody.put("cacheHitRate", global.cacheHitRate());

        Map<String, Object> providers = new LinkedHashMap<>();
        stats.providers().forEach((name, status) -> {
            ProviderMetrics metrics = status.metrics();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("averageResponseTimeMs", metrics.averageResponseTimeMs());
            entry.put("successRate", metrics.successRate());
            entry.put("totalRequests", metrics.totalRequests());
            entry.put("enabled", status.enabled());
            entry.put("temporarilyDisabled", metrics.temporarilyDisabled());
            providers.put(name, entry);
        });

        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("hitRate", stats.cache().hitRate());
        cache.put("size", stats.cache().size());
        cache.put("maxSize", stats.cache().maxSize());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("global", globalBody);
        body.put("providers", providers);
        body.put("cache", cache);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    /**
     * Runs a health check against every provider
     *
     * @return health by provider; 503 when any provider reports unhealthy
     */
    @GetMapping("/health")
    public CompletableFuture<ResponseEntity<Map<String, ProviderHealth>>> health() {
        return resolutionManager.healthCheckAll()
            .thenApply(results -> {
                boolean allHealthy = results.values().stream().allMatch(ProviderHealth::healthy);
                return ResponseEntity.status(allHealthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(results);
            })
            .exceptionally(e -> {
                logger.error("Poster provider health check failed", e);
                return ResponseEntity.internalServerError().build();
            });
    }

    @PostMapping("/maintenance/clear-cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        logger.info("Admin endpoint /admin/posters/maintenance/clear-cache invoked.");
        resolutionManager.clearCache();
        return ResponseEntity.ok(message("Poster cache cleared"));
    }

    @PostMapping("/maintenance/cleanup-cache")
    public ResponseEntity<Map<String, Object>> cleanupCache() {
        int removed = resolutionManager.cleanupCache();
        Map<String, Object> body = message("Expired poster cache entries removed");
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/maintenance/reset-metrics")
    public ResponseEntity<Map<String, Object>> resetMetrics() {
        logger.info("Admin endpoint /admin/posters/maintenance/reset-metrics invoked.");
        resolutionManager.resetMetrics();
        return ResponseEntity.ok(message("Poster metrics reset"));
    }

    @PostMapping("/maintenance/reset-providers")
    public ResponseEntity<Map<String, Object>> resetProviders() {
        logger.info("Admin endpoint /admin/posters/maintenance/reset-providers invoked.");
        List<String> reactivated = resolutionManager.reactivateDisabledProviders();
        Map<String, Object> body = message(reactivated.size() + " provider(s) reactivated");
        body.put("reactivated", reactivated);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/providers/{name}/enabled")
    public ResponseEntity<Map<String, Object>> setEnabled(@PathVariable("name") String name,
                                                          @RequestParam("value") boolean value) {
        if (!resolutionManager.setProviderEnabled(name, value)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(message("Provider " + name + (value ? " enabled" : " disabled")));
    }

    /**
     * Changes priority, timeout or enabled flag of a provider; omitted fields keep their value
     *
     * @param name provider name
     * @param update partial configuration
     * @return the provider status after the change, 404 for an unknown provider, 400 for an invalid update
     */
    @PutMapping("/providers/{name}/config")
    public ResponseEntity<?> updateConfig(@PathVariable("name") String name,
                                          @RequestBody ProviderConfigUpdate update) {
        try {
            return resolutionManager.updateProviderConfig(name, update)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected config update for poster provider '{}': {}", name, e.getMessage());
            return ResponseEntity.badRequest().body(message(e.getMessage()));
        }
    }

    /**
     * Forces a provider circuit open or closed
     *
     * @param name provider name
     * @param action {@code open} or {@code close}
     * @return 400 for any other action, 404 for an unknown provider
     */
    @PostMapping("/providers/{name}/circuit/{action}")
    public ResponseEntity<Map<String, Object>> overrideCircuit(@PathVariable("name") String name,
                                                               @PathVariable("action") String action) {
        boolean found;
        switch (action) {
            case "open":
                found = resolutionManager.forceOpenProvider(name);
                break;
            case "close":
                found = resolutionManager.forceCloseProvider(name);
                break;
            default:
                return ResponseEntity.badRequest().body(message("Unknown circuit action: " + action));
        }
        if (!found) {
            return ResponseEntity.notFound().build();
        }
        logger.info("Circuit for poster provider {} forced {}", name, action);
        return ResponseEntity.ok(message("Circuit for " + name + " forced " + action));
    }

    private static Map<String, Object> message(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", text);
        return body;
    }
}
