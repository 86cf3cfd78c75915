package com.williamcallahan.poster_resolution_engine.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window rate limiter for a single provider
 *
 * @author William Callahan
 *
 * Features:
 * - Holds at most {@code maxRequests} reservation timestamps within {@code window}
 * - A caller over the limit is assigned the slot freed by the oldest reservation plus a safety margin
 * - Waiting is a scheduled completion, never a blocked thread
 * - Reservations are non-decreasing so concurrent callers are served in arrival order
 */
public class SlidingWindowRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final String name;
    private final int maxRequests;
    private final long windowMs;
    private final long marginMs;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    // Guarded by this
    private final Deque<Long> reservations = new ArrayDeque<>();

    public SlidingWindowRateLimiter(String name,
                                    int maxRequests,
                                    Duration window,
                                    Duration margin,
                                    Clock clock,
                                    ScheduledExecutorService scheduler) {
        this.name = name;
        this.maxRequests = maxRequests;
        this.windowMs = window.toMillis();
        this.marginMs = margin.toMillis();
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Reserves the next slot
     *
     * @return milliseconds the caller must wait before using its slot, 0 when it may go now
     */
    public synchronized long reserve() {
        if (maxRequests <= 0) {
            return 0L;
        }
        long now = clock.millis();
        while (!reservations.isEmpty() && reservations.peekFirst() <= now - windowMs) {
            reservations.pollFirst();
        }
        if (reservations.size() < maxRequests) {
            // Queued reservations may already sit in the future
            long slot = reservations.isEmpty() ? now : Math.max(now, reservations.peekLast());
            reservations.addLast(slot);
            return slot - now;
        }
        long oldest = reservations.pollFirst();
        long slot = Math.max(oldest + windowMs + marginMs, reservations.isEmpty() ? now : reservations.peekLast());
        reservations.addLast(slot);
        return Math.max(0L, slot - now);
    }

    /**
     * @return future that completes once the caller's reserved slot is reached
     */
    public CompletableFuture<Void> acquire() {
        long delayMs = reserve();
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        logger.debug("Rate limit reached for provider '{}'; delaying attempt by {}ms", name, delayMs);
        CompletableFuture<Void> ready = new CompletableFuture<>();
        scheduler.schedule(() -> ready.complete(null), delayMs, TimeUnit.MILLISECONDS);
        return ready;
    }

    /**
     * @return reservations still inside the current window
     */
    public synchronized int inWindow() {
        long now = clock.millis();
        return (int) reservations.stream().filter(ts -> ts > now - windowMs).count();
    }
}
