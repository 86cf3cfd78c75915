package com.williamcallahan.poster_resolution_engine.monitoring;

import com.williamcallahan.poster_resolution_engine.testutil.MutableClock;
import com.williamcallahan.poster_resolution_engine.types.GlobalMetrics;
import com.williamcallahan.poster_resolution_engine.types.ProviderErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResolutionMetricsRecorderTest {

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ResolutionMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock();
        recorder = new ResolutionMetricsRecorder(meterRegistry, clock);
    }

    @Test
    void aggregatesBySourceAndErrorKind() {
        recorder.recordCacheMiss();
        recorder.recordProviderFailure("kitsu", ProviderErrorKind.TIMEOUT);
        recorder.recordSuccess("tmdb", 40);
        recorder.recordCacheHit();
        recorder.recordFailure("all_sources_failed", 20);

        GlobalMetrics metrics = recorder.snapshot();

        assertThat(metrics.totalRequests()).isEqualTo(2);
        assertThat(metrics.successfulRequests()).isEqualTo(1);
        assertThat(metrics.failedRequests()).isEqualTo(1);
        assertThat(metrics.cacheHits()).isEqualTo(1);
        assertThat(metrics.cacheMisses()).isEqualTo(1);
        assertThat(metrics.sourceUsage().get("tmdb")).isEqualTo(new GlobalMetrics.SourceUsage(1, 0));
        assertThat(metrics.sourceUsage().get("kitsu")).isEqualTo(new GlobalMetrics.SourceUsage(0, 1));
        assertThat(metrics.errorKinds()).containsEntry("timeout", 1L).containsEntry("all_sources_failed", 1L);
        assertThat(metrics.averageResponseTimeMs()).isCloseTo(30.0, within(0.001));
        assertThat(metrics.cacheHitRate()).isCloseTo(0.5, within(0.001));
    }

    @Test
    void errorIsClassifiedByExceptionType() {
        recorder.recordError(new IllegalStateException("boom"), 5);

        assertThat(recorder.errorBreakdown()).containsEntry("IllegalStateException", 1L);
        assertThat(recorder.snapshot().failedRequests()).isEqualTo(1);
    }

    @Test
    void mirrorsEventsIntoMicrometer() {
        recorder.recordCacheHit();
        recorder.recordSuccess("kitsu", 12);
        recorder.recordProviderFailure("tmdb", ProviderErrorKind.TRANSPORT_FAILURE);

        assertThat(meterRegistry.get("poster.cache.requests").tag("result", "hit").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("poster.resolutions").tag("source", "kitsu").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("poster.provider.failures").tag("kind", "transport_failure").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("poster.resolution.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void snapshotIsStableWithoutMutation() {
        recorder.recordSuccess("kitsu", 10);
        clock.advance(Duration.ofMinutes(5));

        assertThat(recorder.snapshot()).isEqualTo(recorder.snapshot());
    }

    @Test
    void resetZeroesInMemoryCountersOnly() {
        recorder.recordSuccess("kitsu", 10);
        clock.advance(Duration.ofSeconds(30));

        recorder.reset();

        GlobalMetrics metrics = recorder.snapshot();
        assertThat(metrics.totalRequests()).isZero();
        assertThat(metrics.sourceUsage()).isEmpty();
        assertThat(metrics.startedAt()).isEqualTo(clock.instant());
        assertThat(meterRegistry.get("poster.resolutions").counter().count()).isEqualTo(1.0);
    }
}
