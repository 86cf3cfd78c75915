/**
 * In-memory poster cache with TTL expiry and LRU eviction
 *
 * @author William Callahan
 *
 * Features:
 * - Capacity-bounded access-ordered map; the least recently touched key is evicted first
 * - Expiry is checked lazily on read and in bulk by {@link #cleanup()}
 * - Optional JSON persistence with debounced background writes
 * - Final synchronous flush on shutdown
 */

package com.williamcallahan.poster_resolution_engine.service.cache;

import com.williamcallahan.poster_resolution_engine.types.CacheEntry;
import com.williamcallahan.poster_resolution_engine.types.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class PosterCache {

    private static final Logger logger = LoggerFactory.getLogger(PosterCache.class);

    private final int maxSize;
    private final long defaultTtlMs;
    private final Clock clock;
    private final PosterCacheFileStore fileStore;
    private final ScheduledExecutorService scheduler;
    private final long persistDebounceMs;

    // Guarded by this; access order doubles as recency order
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long hits;
    private long misses;
    private long sets;
    private long evictions;

    private final Object persistLock = new Object();
    private ScheduledFuture<?> pendingSave;

    /**
     * Creates a memory-only cache
     */
    public PosterCache(int maxSize, Duration defaultTtl, Clock clock) {
        this(maxSize, defaultTtl, clock, null, null, Duration.ZERO);
    }

    /**
     * @param fileStore persistence target, or null for a memory-only cache
     * @param scheduler executor for debounced writes; required when {@code fileStore} is set
     * @param persistDebounce quiet period before a pending write runs
     */
    public PosterCache(int maxSize,
                       Duration defaultTtl,
                       Clock clock,
                       PosterCacheFileStore fileStore,
                       ScheduledExecutorService scheduler,
                       Duration persistDebounce) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (fileStore != null && scheduler == null) {
            throw new IllegalArgumentException("A scheduler is required when persistence is enabled");
        }
        this.maxSize = maxSize;
        this.defaultTtlMs = defaultTtl.toMillis();
        this.clock = clock;
        this.fileStore = fileStore;
        this.scheduler = scheduler;
        this.persistDebounceMs = persistDebounce.toMillis();
    }

    /**
     * Restores non-expired entries and cumulative counters from disk when persistence is enabled
     */
    public void initialize() {
        if (fileStore == null) {
            return;
        }
        fileStore.read().ifPresent(snapshot -> {
            long now = clock.millis();
            int loaded = 0;
            int expired = 0;
            synchronized (this) {
                for (Map.Entry<String, CacheEntry> stored : snapshot.entries().entrySet()) {
                    CacheEntry entry = stored.getValue();
                    if (entry == null || entry.isExpired(now)) {
                        expired++;
                        continue;
                    }
                    if (entries.size() >= maxSize) {
                        break;
                    }
                    entries.put(stored.getKey(), entry);
                    loaded++;
                }
                if (snapshot.stats() != null) {
                    sets = snapshot.stats().sets();
                    evictions = snapshot.stats().evictions();
                }
            }
            logger.info("Poster cache loaded from {}: {} valid entries, {} expired", fileStore.getPath(), loaded, expired);
        });
    }

    public synchronized Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        CacheEntry touched = entry.withHit();
        entries.put(key, touched);
        hits++;
        return Optional.of(touched);
    }

    /**
     * Stores a resolved URL under the default TTL
     */
    public void put(String key, String url, String sourceName) {
        set(key, CacheEntry.of(key, url, sourceName, clock.millis(), defaultTtlMs));
    }

    public void set(String key, CacheEntry entry) {
        CacheEntry normalized = entry.ttlMs() > 0
                ? entry
                : new CacheEntry(key, entry.resultUrl(), entry.sourceName(), entry.createdAtEpochMs(), defaultTtlMs, entry.hitCount());
        synchronized (this) {
            if (entries.size() >= maxSize && !entries.containsKey(key)) {
                Iterator<String> eldest = entries.keySet().iterator();
                String evictedKey = eldest.next();
                eldest.remove();
                evictions++;
                logger.debug("LRU eviction of {} (size {}, max {})", evictedKey, entries.size(), maxSize);
            }
            // Re-insert so an existing key also moves to the most recent end
            entries.remove(key);
            entries.put(key, normalized);
            sets++;
        }
        scheduleSave();
    }

    public boolean invalidate(String key) {
        boolean existed;
        synchronized (this) {
            existed = entries.remove(key) != null;
        }
        if (existed) {
            scheduleSave();
        }
        return existed;
    }

    public void clear() {
        synchronized (this) {
            evictions += entries.size();
            entries.clear();
        }
        scheduleSave();
    }

    /**
     * Removes every expired entry
     *
     * @return number of entries removed
     */
    public synchronized int cleanup() {
        long now = clock.millis();
        int removed = 0;
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Poster cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    public synchronized CacheStats stats() {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new CacheStats(hits, misses, sets, evictions, entries.size(), maxSize, hitRate);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getDefaultTtlMs() {
        return defaultTtlMs;
    }

    public boolean isPersistent() {
        return fileStore != null;
    }

    /**
     * Cancels any pending write, flushes synchronously and empties the in-memory store
     */
    public void shutdown() {
        if (fileStore != null) {
            synchronized (persistLock) {
                if (pendingSave != null) {
                    pendingSave.cancel(false);
                    pendingSave = null;
                }
            }
            flush();
        }
        synchronized (this) {
            entries.clear();
        }
    }

    /**
     * Writes the current contents to disk immediately
     *
     * @return true if the write succeeded or persistence is disabled
     */
    public boolean flush() {
        if (fileStore == null) {
            return true;
        }
        PosterCacheFileStore.Snapshot snapshot = snapshot();
        try {
            fileStore.write(snapshot);
            return true;
        } catch (IOException e) {
            logger.error("Failed to persist poster cache to {}", fileStore.getPath(), e);
            return false;
        }
    }

    private synchronized PosterCacheFileStore.Snapshot snapshot() {
        return new PosterCacheFileStore.Snapshot(
                PosterCacheFileStore.FORMAT_VERSION,
                clock.millis(),
                new LinkedHashMap<>(entries),
                new PosterCacheFileStore.Stats(sets, evictions, entries.size()));
    }

    private void scheduleSave() {
        if (fileStore == null) {
            return;
        }
        synchronized (persistLock) {
            if (pendingSave != null) {
                pendingSave.cancel(false);
            }
            pendingSave = scheduler.schedule(this::flush, persistDebounceMs, TimeUnit.MILLISECONDS);
        }
    }
}
