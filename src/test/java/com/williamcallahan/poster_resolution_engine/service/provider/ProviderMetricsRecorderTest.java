package com.williamcallahan.poster_resolution_engine.service.provider;

import com.williamcallahan.poster_resolution_engine.testutil.MutableClock;
import com.williamcallahan.poster_resolution_engine.types.ProviderMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProviderMetricsRecorderTest {

    private final MutableClock clock = new MutableClock();
    private final ProviderMetricsRecorder recorder = new ProviderMetricsRecorder(clock);

    @Test
    void tracksCountsAndLastOutcome() {
        recorder.recordSuccess(100);
        recorder.recordFailure("boom", 300);

        ProviderMetrics metrics = recorder.snapshot(1, false);

        assertThat(metrics.totalRequests()).isEqualTo(2);
        assertThat(metrics.successfulRequests()).isEqualTo(1);
        assertThat(metrics.failedRequests()).isEqualTo(1);
        assertThat(metrics.lastError()).isEqualTo("boom");
        assertThat(metrics.lastSuccessAt()).isEqualTo(clock.instant());
        assertThat(metrics.averageResponseTimeMs()).isCloseTo(200.0, within(0.001));
        assertThat(metrics.successRate()).isCloseTo(0.5, within(0.001));
    }

    @Test
    void averageCoversOnlyRecentSamples() {
        for (int i = 0; i < ProviderMetricsRecorder.RESPONSE_TIME_SAMPLES; i++) {
            recorder.recordSuccess(1_000);
        }
        for (int i = 0; i < ProviderMetricsRecorder.RESPONSE_TIME_SAMPLES; i++) {
            recorder.recordSuccess(10);
        }

        assertThat(recorder.snapshot(0, false).averageResponseTimeMs()).isCloseTo(10.0, within(0.001));
    }

    @Test
    void resetClearsEverything() {
        recorder.recordSuccess(5);
        recorder.recordFailure("x", 5);

        recorder.reset();

        ProviderMetrics metrics = recorder.snapshot(0, false);
        assertThat(metrics.totalRequests()).isZero();
        assertThat(metrics.lastError()).isNull();
        assertThat(metrics.lastSuccessAt()).isNull();
        assertThat(metrics.averageResponseTimeMs()).isZero();
    }
}
