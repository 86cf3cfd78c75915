package com.williamcallahan.poster_resolution_engine.service.provider;

import com.williamcallahan.poster_resolution_engine.types.ProviderMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Request statistics for a single provider, updated only by that provider's attempts
 *
 * @author William Callahan
 */
public class ProviderMetricsRecorder {

    static final int RESPONSE_TIME_SAMPLES = 100;

    private final Clock clock;

    // Guarded by this
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private String lastError;
    private Instant lastSuccessAt;
    private final Deque<Long> responseTimes = new ArrayDeque<>();
    private long responseTimeSum;

    public ProviderMetricsRecorder(Clock clock) {
        this.clock = clock;
    }

    public synchronized void recordSuccess(long elapsedMs) {
        totalRequests++;
        successfulRequests++;
        lastSuccessAt = clock.instant();
        addSample(elapsedMs);
    }

    public synchronized void recordFailure(String error, long elapsedMs) {
        totalRequests++;
        failedRequests++;
        lastError = error;
        addSample(elapsedMs);
    }

    public synchronized void reset() {
        totalRequests = 0;
        successfulRequests = 0;
        failedRequests = 0;
        lastError = null;
        lastSuccessAt = null;
        responseTimes.clear();
        responseTimeSum = 0;
    }

    /**
     * @param consecutiveFailures current breaker failure count
     * @param temporarilyDisabled whether the breaker is currently rejecting attempts
     */
    public synchronized ProviderMetrics snapshot(int consecutiveFailures, boolean temporarilyDisabled) {
        double average = responseTimes.isEmpty() ? 0.0 : (double) responseTimeSum / responseTimes.size();
        return new ProviderMetrics(totalRequests, successfulRequests, failedRequests, consecutiveFailures,
                average, lastError, lastSuccessAt, temporarilyDisabled);
    }

    private void addSample(long elapsedMs) {
        responseTimes.addLast(elapsedMs);
        responseTimeSum += elapsedMs;
        if (responseTimes.size() > RESPONSE_TIME_SAMPLES) {
            responseTimeSum -= responseTimes.pollFirst();
        }
    }
}
