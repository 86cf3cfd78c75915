/**
 * Managed poster provider wrapping a raw {@link PosterSource}
 *
 * @author William Callahan
 *
 * Features:
 * - Rejects attempts up front when disabled or when the circuit refuses permission
 * - Waits for a rate-limit slot without blocking a thread
 * - Races each attempt against a Resilience4j TimeLimiter and cancels the loser
 * - Records elapsed time and outcome in metrics and the circuit breaker
 * - A "not found" answer counts as a success
 * - Priority, timeout and the enabled flag can be changed at runtime
 */

package com.williamcallahan.poster_resolution_engine.service.provider;

import com.williamcallahan.poster_resolution_engine.service.resilience.CircuitBreaker;
import com.williamcallahan.poster_resolution_engine.service.resilience.SlidingWindowRateLimiter;
import com.williamcallahan.poster_resolution_engine.types.CircuitState;
import com.williamcallahan.poster_resolution_engine.types.PosterProvider;
import com.williamcallahan.poster_resolution_engine.types.ProviderConfigUpdate;
import com.williamcallahan.poster_resolution_engine.types.PosterSource;
import com.williamcallahan.poster_resolution_engine.types.ProviderErrorKind;
import com.williamcallahan.poster_resolution_engine.types.ProviderMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

public class GuardedPosterProvider implements PosterProvider {

    private static final Logger logger = LoggerFactory.getLogger(GuardedPosterProvider.class);

    private final PosterSource source;
    private final CircuitBreaker circuitBreaker;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ProviderMetricsRecorder metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    // Replaced together by applyConfig
    private volatile ProviderSettings settings;
    private volatile TimeLimiter timeLimiter;

    private volatile boolean enabled;

    public GuardedPosterProvider(PosterSource source,
                                 ProviderSettings settings,
                                 ScheduledExecutorService scheduler,
                                 Clock clock) {
        this.source = source;
        this.settings = settings;
        this.scheduler = scheduler;
        this.clock = clock;
        this.enabled = settings.enabled();
        this.circuitBreaker = new CircuitBreaker(settings.name(), settings.failureThreshold(), settings.cooldown(), clock);
        this.rateLimiter = new SlidingWindowRateLimiter(settings.name(), settings.rateLimitRequests(),
                settings.rateLimitWindow(), settings.rateLimitMargin(), clock, scheduler);
        this.metrics = new ProviderMetricsRecorder(clock);
        this.timeLimiter = timeLimiterFor(settings);
    }

    @Override
    public String getName() {
        return settings.name();
    }

    @Override
    public int getPriority() {
        return settings.priority();
    }

    @Override
    public Duration getTimeout() {
        return settings.timeout();
    }

    @Override
    public synchronized void applyConfig(ProviderConfigUpdate update) {
        update.validate();
        ProviderSettings updated = settings;
        if (update.priority() != null) {
            updated = updated.withPriority(update.priority());
        }
        if (update.timeout() != null && !update.timeout().equals(updated.timeout())) {
            updated = updated.withTimeout(update.timeout());
            timeLimiter = timeLimiterFor(updated);
        }
        settings = updated;
        if (update.enabled() != null) {
            setEnabled(update.enabled());
        }
        logger.info("Provider {} reconfigured: priority {}, timeout {}ms, enabled {}",
                getName(), updated.priority(), updated.timeout().toMillis(), enabled);
    }

    @Override
    public CompletableFuture<Optional<String>> fetch(String itemId, String itemName) {
        if (!enabled) {
            return CompletableFuture.failedFuture(new ProviderFetchException(getName(),
                    ProviderErrorKind.UNAVAILABLE, "Provider " + getName() + " is disabled"));
        }
        if (!circuitBreaker.tryAcquirePermission()) {
            logger.debug("Provider {} refused by circuit breaker: {}", getName(), circuitBreaker.describe());
            return CompletableFuture.failedFuture(new ProviderFetchException(getName(), ProviderErrorKind.UNAVAILABLE,
                    "Provider " + getName() + " is temporarily disabled until " + circuitBreaker.getNextAttemptAt()));
        }

        TimeLimiter limiter = timeLimiter;
        Duration timeout = settings.timeout();
        return rateLimiter.acquire().thenCompose(ready -> {
            long start = clock.millis();
            return limiter.executeCompletionStage(scheduler, () -> invokeSource(itemId, itemName))
                    .toCompletableFuture()
                    .handle((result, error) -> {
                        long elapsed = clock.millis() - start;
                        if (error == null) {
                            return onAnswer(result, itemId, elapsed);
                        }
                        ProviderFetchException failure = classify(error, timeout);
                        if (failure.getKind() == ProviderErrorKind.NOT_FOUND) {
                            return onAnswer(Optional.empty(), itemId, elapsed);
                        }
                        if (failure.getKind().countsAsFailure()) {
                            metrics.recordFailure(failure.getMessage(), elapsed);
                            circuitBreaker.onFailure();
                        } else {
                            circuitBreaker.releasePermission();
                        }
                        throw failure;
                    });
        });
    }

    private Optional<String> onAnswer(Optional<String> result, String itemId, long elapsed) {
        metrics.recordSuccess(elapsed);
        circuitBreaker.onSuccess();
        Optional<String> url = result == null ? Optional.empty() : result.filter(u -> !u.isBlank());
        logger.debug("Provider {} answered for {} in {}ms (found: {})", getName(), itemId, elapsed, url.isPresent());
        return url;
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return timeLimiter.executeCompletionStage(scheduler, source::healthCheck)
                .toCompletableFuture()
                .exceptionally(ex -> {
                    logger.warn("Health check for provider {} failed: {}", getName(), ex.getMessage());
                    return false;
                });
    }

    @Override
    public ProviderMetrics getMetrics() {
        return metrics.snapshot(circuitBreaker.getConsecutiveFailures(), !circuitBreaker.isCallPermitted());
    }

    @Override
    public void resetMetrics() {
        metrics.reset();
        circuitBreaker.forceClose();
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (enabled && circuitBreaker.getState() != CircuitState.CLOSED) {
            circuitBreaker.forceClose();
        }
        logger.info("Provider {} {}", getName(), enabled ? "enabled" : "disabled");
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean isAvailable() {
        return enabled && circuitBreaker.isCallPermitted();
    }

    @Override
    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    @Override
    public void forceOpen() {
        circuitBreaker.forceOpen();
    }

    @Override
    public void forceClose() {
        circuitBreaker.forceClose();
    }

    private CompletableFuture<Optional<String>> invokeSource(String itemId, String itemName) {
        try {
            CompletableFuture<Optional<String>> future = source.fetchPoster(itemId, itemName);
            return future != null ? future : CompletableFuture.completedFuture(Optional.empty());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ProviderFetchException classify(Throwable error, Duration timeout) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            logger.warn("Provider {} timed out after {}ms", getName(), timeout.toMillis());
            return new ProviderFetchException(getName(), ProviderErrorKind.TIMEOUT,
                    "Timeout after " + timeout.toMillis() + "ms", cause);
        }
        ProviderFetchException failure = ProviderFetchException.from(getName(), cause);
        logger.warn("Provider {} failed: [{}] {}", failure.getProviderName(), failure.getKind().getTag(),
                failure.getMessage());
        return failure;
    }

    private static TimeLimiter timeLimiterFor(ProviderSettings settings) {
        return TimeLimiter.of(settings.name(), TimeLimiterConfig.custom()
                .timeoutDuration(settings.timeout())
                .cancelRunningFuture(true)
                .build());
    }
}
