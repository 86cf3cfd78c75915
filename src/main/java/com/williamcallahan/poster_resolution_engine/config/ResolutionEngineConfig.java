/**
 * Wires the poster resolution engine
 *
 * @author William Callahan
 *
 * Features:
 * - Shared daemon scheduler for timeouts, rate-limit delays and debounced cache writes
 * - Cache with optional JSON persistence
 * - One guarded provider per configured and registered poster source
 * - Resolution manager bound to the context lifecycle
 */

package com.williamcallahan.poster_resolution_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.poster_resolution_engine.monitoring.ResolutionMetricsRecorder;
import com.williamcallahan.poster_resolution_engine.service.FallbackChain;
import com.williamcallahan.poster_resolution_engine.service.ResolutionManager;
import com.williamcallahan.poster_resolution_engine.service.cache.PosterCache;
import com.williamcallahan.poster_resolution_engine.service.cache.PosterCacheFileStore;
import com.williamcallahan.poster_resolution_engine.service.provider.GuardedPosterProvider;
import com.williamcallahan.poster_resolution_engine.service.provider.ProviderSettings;
import com.williamcallahan.poster_resolution_engine.types.PosterSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(PosterResolutionProperties.class)
public class ResolutionEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionEngineConfig.class);

    @Bean
    public Clock posterClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService posterScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "poster-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public PosterCache posterCache(PosterResolutionProperties properties,
                                   Clock posterClock,
                                   ScheduledExecutorService posterScheduler,
                                   ObjectMapper objectMapper) {
        PosterResolutionProperties.Cache cache = properties.getCache();
        PosterCacheFileStore fileStore = cache.isPersist()
            ? new PosterCacheFileStore(Path.of(cache.getFilePath()), objectMapper)
            : null;
        return new PosterCache(cache.getMaxSize(), cache.getTtl(), posterClock, fileStore, posterScheduler,
            cache.getPersistDebounce());
    }

    @Bean
    public ResolutionMetricsRecorder resolutionMetricsRecorder(MeterRegistry meterRegistry, Clock posterClock) {
        return new ResolutionMetricsRecorder(meterRegistry, posterClock);
    }

    @Bean
    public FallbackChain fallbackChain(List<PosterSource> sources,
                                       PosterResolutionProperties properties,
                                       ResolutionMetricsRecorder resolutionMetricsRecorder,
                                       ScheduledExecutorService posterScheduler,
                                       Clock posterClock) {
        FallbackChain chain = new FallbackChain(resolutionMetricsRecorder, posterClock);
        for (PosterSource source : sources) {
            if (!properties.getProviders().containsKey(source.getName())) {
                logger.info("Poster source {} has no configuration entry; not registering it", source.getName());
                continue;
            }
            ProviderSettings settings = ProviderSettings.from(source.getName(), properties);
            PosterResolutionProperties.Provider provider = properties.getProviders().get(source.getName());
            if (settings.enabled() && provider.getApiKey() != null && provider.getApiKey().isBlank()) {
                logger.warn("Poster provider {} has a blank API key; registering it disabled", source.getName());
                settings = settings.withEnabled(false);
            }
            chain.registerProvider(new GuardedPosterProvider(source, settings, posterScheduler, posterClock));
        }
        return chain;
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public ResolutionManager resolutionManager(PosterCache posterCache,
                                               FallbackChain fallbackChain,
                                               ResolutionMetricsRecorder resolutionMetricsRecorder,
                                               PosterResolutionProperties properties,
                                               Clock posterClock) {
        return new ResolutionManager(posterCache, fallbackChain, resolutionMetricsRecorder,
            properties.getProviders().keySet(), posterClock);
    }
}
