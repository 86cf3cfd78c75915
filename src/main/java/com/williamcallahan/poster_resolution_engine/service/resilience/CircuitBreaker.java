/**
 * Per-provider circuit breaker driven by consecutive failures
 * Removes a failing provider from rotation and lets a single trial call through after the cooldown
 *
 * @author William Callahan
 *
 * Features:
 * - CLOSED, OPEN and HALF_OPEN states with lazy clock-based recovery (no timers)
 * - Exactly one trial call admitted once the cooldown has elapsed
 * - A success in any state closes the circuit and clears the failure count
 * - Manual force-open and force-close overrides for administrative recovery
 */

package com.williamcallahan.poster_resolution_engine.service.resilience;

import com.williamcallahan.poster_resolution_engine.types.CircuitState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    // Guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant nextAttemptAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1 for " + name);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Asks to run an attempt. An OPEN circuit whose cooldown has elapsed moves to HALF_OPEN
     * and admits the caller as its single trial call.
     *
     * @return true if the caller may proceed
     */
    public synchronized boolean tryAcquirePermission() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (!clock.instant().isBefore(nextAttemptAt)) {
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                    log.info("Circuit for provider '{}' moved to HALF_OPEN; admitting trial call", name);
                    return true;
                }
                log.debug("Circuit for provider '{}' is OPEN until {}", name, nextAttemptAt);
                return false;
            case HALF_OPEN:
                if (!trialInFlight) {
                    trialInFlight = true;
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    /**
     * Read-only form of {@link #tryAcquirePermission()}. Reports true once an OPEN circuit's
     * cooldown has elapsed so the caller reaches the trial call.
     */
    public synchronized boolean isCallPermitted() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                return !clock.instant().isBefore(nextAttemptAt);
            case HALF_OPEN:
                return !trialInFlight;
            default:
                return false;
        }
    }

    public synchronized void onSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit for provider '{}' CLOSED after successful attempt", name);
        }
        close();
    }

    public synchronized void onFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            open();
            log.warn("Trial call for provider '{}' failed; circuit re-OPENED until {}", name, nextAttemptAt);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
            log.warn("Circuit for provider '{}' OPENED after {} consecutive failures; next attempt at {}",
                    name, consecutiveFailures, nextAttemptAt);
        }
    }

    /**
     * Returns a permission without recording an outcome, for attempts that ended in neither
     * success nor a counted failure. A HALF_OPEN circuit admits its next trial call.
     */
    public synchronized void releasePermission() {
        trialInFlight = false;
    }

    public synchronized void forceOpen() {
        open();
        log.info("Circuit for provider '{}' manually forced OPEN until {}", name, nextAttemptAt);
    }

    public synchronized void forceClose() {
        close();
        log.info("Circuit for provider '{}' manually forced CLOSED", name);
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public synchronized Map<String, Object> describe() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", state);
        details.put("consecutiveFailures", consecutiveFailures);
        details.put("failureThreshold", failureThreshold);
        details.put("cooldownMs", cooldown.toMillis());
        if (nextAttemptAt != null) {
            details.put("nextAttemptAt", nextAttemptAt.toString());
        }
        return details;
    }

    private void open() {
        state = CircuitState.OPEN;
        trialInFlight = false;
        nextAttemptAt = clock.instant().plus(cooldown);
    }

    private void close() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
        nextAttemptAt = null;
    }
}
