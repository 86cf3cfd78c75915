/**
 * Global resolution metrics owned by the resolution manager
 * Keeps resettable in-memory counters and mirrors every event into Micrometer
 *
 * @author William Callahan
 */

package com.williamcallahan.poster_resolution_engine.monitoring;

import com.williamcallahan.poster_resolution_engine.types.GlobalMetrics;
import com.williamcallahan.poster_resolution_engine.types.ProviderErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public class ResolutionMetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionMetricsRecorder.class);

    static final int RESPONSE_TIME_SAMPLES = 1000;

    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Micrometer meters are cumulative and survive reset()
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Timer resolutionTimer;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder successfulRequests = new LongAdder();
    private final LongAdder failedRequests = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final Map<String, LongAdder> sourceSuccesses = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> sourceFailures = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> errorKinds = new ConcurrentHashMap<>();

    // Guarded by responseTimes
    private final Deque<Long> responseTimes = new ArrayDeque<>();
    private long responseTimeSum;

    private volatile Instant startedAt;

    public ResolutionMetricsRecorder(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.startedAt = clock.instant();

        this.cacheHitCounter = Counter.builder("poster.cache.requests")
            .description("Poster cache lookups")
            .tag("result", "hit")
            .register(meterRegistry);

        this.cacheMissCounter = Counter.builder("poster.cache.requests")
            .description("Poster cache lookups")
            .tag("result", "miss")
            .register(meterRegistry);

        this.resolutionTimer = Timer.builder("poster.resolution.duration")
            .description("Time spent resolving a poster, cache hits included")
            .register(meterRegistry);
    }

    public void recordCacheHit() {
        cacheHits.increment();
        cacheHitCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
        cacheMissCounter.increment();
    }

    /**
     * Records a resolved request attributed to {@code sourceName}
     */
    public void recordSuccess(String sourceName, long elapsedMs) {
        totalRequests.increment();
        successfulRequests.increment();
        sourceSuccesses.computeIfAbsent(sourceName, k -> new LongAdder()).increment();
        addResponseTime(elapsedMs);
        resolutionCounter("success", sourceName).increment();
    }

    /**
     * Records an unresolved request; {@code reason} is the sentinel or error classification
     */
    public void recordFailure(String reason, long elapsedMs) {
        totalRequests.increment();
        failedRequests.increment();
        errorKinds.computeIfAbsent(reason, k -> new LongAdder()).increment();
        addResponseTime(elapsedMs);
        resolutionCounter("failure", reason).increment();
    }

    /**
     * Records one failed provider attempt inside a chain walk; request totals are untouched
     */
    public void recordProviderFailure(String providerName, ProviderErrorKind kind) {
        sourceFailures.computeIfAbsent(providerName, k -> new LongAdder()).increment();
        errorKinds.computeIfAbsent(kind.getTag(), k -> new LongAdder()).increment();
        Counter.builder("poster.provider.failures")
            .description("Failed provider attempts by kind")
            .tag("provider", providerName)
            .tag("kind", kind.getTag())
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records an unexpected internal error, classified by exception type
     */
    public void recordError(Throwable error, long elapsedMs) {
        String kind = error == null ? "UnknownError" : error.getClass().getSimpleName();
        recordFailure(kind, elapsedMs);
    }

    public GlobalMetrics snapshot() {
        double average;
        synchronized (responseTimes) {
            average = responseTimes.isEmpty() ? 0.0 : (double) responseTimeSum / responseTimes.size();
        }
        return new GlobalMetrics(
            totalRequests.sum(),
            successfulRequests.sum(),
            failedRequests.sum(),
            cacheHits.sum(),
            cacheMisses.sum(),
            average,
            sourceBreakdown(),
            errorBreakdown(),
            startedAt
        );
    }

    /**
     * @return success and failure tallies per source, sorted by name
     */
    public Map<String, GlobalMetrics.SourceUsage> sourceBreakdown() {
        Map<String, GlobalMetrics.SourceUsage> usage = new TreeMap<>();
        sourceSuccesses.forEach((name, count) -> usage.put(name, new GlobalMetrics.SourceUsage(count.sum(), 0L)));
        sourceFailures.forEach((name, count) -> usage.merge(name, new GlobalMetrics.SourceUsage(0L, count.sum()),
            (a, b) -> new GlobalMetrics.SourceUsage(a.success() + b.success(), a.failure() + b.failure())));
        return usage;
    }

    public Map<String, Long> errorBreakdown() {
        Map<String, Long> breakdown = new TreeMap<>();
        errorKinds.forEach((kind, count) -> breakdown.put(kind, count.sum()));
        return breakdown;
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    public void reset() {
        totalRequests.reset();
        successfulRequests.reset();
        failedRequests.reset();
        cacheHits.reset();
        cacheMisses.reset();
        sourceSuccesses.clear();
        sourceFailures.clear();
        errorKinds.clear();
        synchronized (responseTimes) {
            responseTimes.clear();
            responseTimeSum = 0;
        }
        startedAt = clock.instant();
        logger.info("Global poster resolution metrics reset");
    }

    private void addResponseTime(long elapsedMs) {
        resolutionTimer.record(Duration.ofMillis(elapsedMs));
        synchronized (responseTimes) {
            responseTimes.addLast(elapsedMs);
            responseTimeSum += elapsedMs;
            if (responseTimes.size() > RESPONSE_TIME_SAMPLES) {
                responseTimeSum -= responseTimes.pollFirst();
            }
        }
    }

    private Counter resolutionCounter(String outcome, String source) {
        return Counter.builder("poster.resolutions")
            .description("Poster resolutions by outcome")
            .tag("outcome", outcome)
            .tag("source", source)
            .register(meterRegistry);
    }
}
