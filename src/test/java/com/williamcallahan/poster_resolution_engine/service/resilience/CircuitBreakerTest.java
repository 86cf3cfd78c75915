package com.williamcallahan.poster_resolution_engine.service.resilience;

import com.williamcallahan.poster_resolution_engine.testutil.MutableClock;
import com.williamcallahan.poster_resolution_engine.types.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("kitsu", 3, Duration.ofSeconds(30), clock);
    }

    @Test
    void opensAfterExactlyThresholdConsecutiveFailures() {
        breaker.onFailure();
        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.tryAcquirePermission()).isTrue();

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
        assertThat(breaker.isCallPermitted()).isFalse();
        assertThat(breaker.getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
    }

    @Test
    void successResetsConsecutiveFailures() {
        breaker.onFailure();
        breaker.onFailure();
        breaker.onSuccess();
        breaker.onFailure();
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    void admitsSingleTrialCallAfterCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(29));
        assertThat(breaker.tryAcquirePermission()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.isCallPermitted()).isTrue();
        assertThat(breaker.tryAcquirePermission()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        // Second caller is rejected while the trial call is in flight
        assertThat(breaker.tryAcquirePermission()).isFalse();
        assertThat(breaker.isCallPermitted()).isFalse();
    }

    @Test
    void successfulTrialCallClosesCircuit() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        breaker.tryAcquirePermission();

        breaker.onSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    void failedTrialCallReopensWithFreshCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        breaker.tryAcquirePermission();

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    void forceOpenIgnoresThreshold() {
        breaker.forceOpen();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    void forceCloseClearsFailures() {
        tripOpen();

        breaker.forceClose();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.getNextAttemptAt()).isNull();
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    void releasedPermissionLetsNextTrialCallThrough() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquirePermission()).isTrue();

        breaker.releasePermission();

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    void describeReportsStateAndNextAttempt() {
        tripOpen();

        assertThat(breaker.describe())
            .containsEntry("state", CircuitState.OPEN)
            .containsEntry("consecutiveFailures", 3)
            .containsEntry("failureThreshold", 3)
            .containsEntry("cooldownMs", 30_000L)
            .containsEntry("nextAttemptAt", clock.instant().plusSeconds(30).toString());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker("tmdb", 0, Duration.ofSeconds(1), clock))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.onFailure();
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }
}
