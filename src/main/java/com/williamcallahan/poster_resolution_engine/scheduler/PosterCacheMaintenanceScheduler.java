package com.williamcallahan.poster_resolution_engine.scheduler;

import com.williamcallahan.poster_resolution_engine.service.ResolutionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler that periodically purges expired poster cache entries.
 */
@Slf4j
@Component
public class PosterCacheMaintenanceScheduler {

    private final ResolutionManager resolutionManager;

    public PosterCacheMaintenanceScheduler(ResolutionManager resolutionManager) {
        this.resolutionManager = resolutionManager;
    }

    /**
     * Runs every {@code app.poster.cache.cleanup-interval} (10 minutes by default).
     */
    @Scheduled(fixedDelayString = "${app.poster.cache.cleanup-interval:PT10M}",
               initialDelayString = "${app.poster.cache.cleanup-interval:PT10M}")
    public void purgeExpiredEntries() {
        try {
            int removed = resolutionManager.cleanupCache();
            log.debug("Poster cache maintenance removed {} expired entries", removed);
        } catch (RuntimeException e) {
            log.error("Poster cache maintenance failed", e);
        }
    }
}
