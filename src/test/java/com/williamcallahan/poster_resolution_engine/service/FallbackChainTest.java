package com.williamcallahan.poster_resolution_engine.service;

import com.williamcallahan.poster_resolution_engine.monitoring.ResolutionMetricsRecorder;
import com.williamcallahan.poster_resolution_engine.service.provider.GuardedPosterProvider;
import com.williamcallahan.poster_resolution_engine.testutil.MutableClock;
import com.williamcallahan.poster_resolution_engine.testutil.ProviderFixtures;
import com.williamcallahan.poster_resolution_engine.testutil.StubPosterSource;
import com.williamcallahan.poster_resolution_engine.types.FallbackResult;
import com.williamcallahan.poster_resolution_engine.types.PosterProvider;
import com.williamcallahan.poster_resolution_engine.types.ProviderConfigUpdate;
import com.williamcallahan.poster_resolution_engine.types.ProviderErrorKind;
import com.williamcallahan.poster_resolution_engine.types.ProviderHealth;
import com.williamcallahan.poster_resolution_engine.types.ProviderStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class FallbackChainTest {

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private ResolutionMetricsRecorder globalMetrics;
    private FallbackChain chain;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        globalMetrics = new ResolutionMetricsRecorder(new SimpleMeterRegistry(), clock);
        chain = new FallbackChain(globalMetrics, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void attemptsProvidersInPriorityOrderRegardlessOfRegistration() {
        List<String> attempts = new ArrayList<>();
        chain.registerProvider(recording("p3", 3, attempts));
        chain.registerProvider(recording("p1", 1, attempts));
        chain.registerProvider(recording("p2", 2, attempts));

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(attempts).containsExactly("p1", "p2", "p3");
        assertThat(result.sourceName()).isEqualTo(FallbackResult.ALL_SOURCES_FAILED);
        assertThat(result.url()).isNull();
    }

    @Test
    void equalPrioritiesKeepRegistrationOrder() {
        List<String> attempts = new ArrayList<>();
        chain.registerProvider(recording("first", 1, attempts));
        chain.registerProvider(recording("second", 1, attempts));

        chain.fetch("1", "X").join();

        assertThat(attempts).containsExactly("first", "second");
    }

    @Test
    void failingProviderFallsThroughToNext() {
        GuardedPosterProvider p1 = ProviderFixtures.guarded(StubPosterSource.failing("P1"), 1, scheduler, clock);
        GuardedPosterProvider p2 = ProviderFixtures.guarded(StubPosterSource.returning("P2", "u2"), 2, scheduler, clock);
        chain.registerProvider(p1);
        chain.registerProvider(p2);

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(result.url()).isEqualTo("u2");
        assertThat(result.sourceName()).isEqualTo("P2");
        assertThat(result.fromCache()).isFalse();
        assertThat(p1.getMetrics().failedRequests()).isEqualTo(1);
        assertThat(p2.getMetrics().successfulRequests()).isEqualTo(1);
        assertThat(globalMetrics.sourceBreakdown().get("P1").failure()).isEqualTo(1);
        assertThat(globalMetrics.errorBreakdown()).containsEntry(ProviderErrorKind.TRANSPORT_FAILURE.getTag(), 1L);
    }

    @Test
    void notFoundContinuesWithoutCountingFailure() {
        GuardedPosterProvider empty = ProviderFixtures.guarded(StubPosterSource.notFound("empty"), 1, scheduler, clock);
        chain.registerProvider(empty);
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.returning("hit", "u"), 2, scheduler, clock));

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(result.sourceName()).isEqualTo("hit");
        assertThat(empty.getMetrics().failedRequests()).isZero();
        assertThat(globalMetrics.errorBreakdown()).isEmpty();
    }

    @Test
    void noEnabledProvidersReturnsSentinel() {
        GuardedPosterProvider provider = ProviderFixtures.guarded(StubPosterSource.returning("p", "u"), 1, scheduler, clock);
        provider.setEnabled(false);
        chain.registerProvider(provider);

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(result.sourceName()).isEqualTo(FallbackResult.NO_SOURCES_AVAILABLE);
        assertThat(result.url()).isNull();
    }

    @Test
    void unavailableProviderIsSkipped() {
        PosterProvider open = mock(PosterProvider.class);
        given(open.getName()).willReturn("open");
        given(open.getPriority()).willReturn(1);
        given(open.isEnabled()).willReturn(true);
        given(open.isAvailable()).willReturn(false);
        chain.registerProvider(open);
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.returning("next", "u"), 2, scheduler, clock));

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(result.sourceName()).isEqualTo("next");
        verify(open, never()).fetch("1", "X");
    }

    @Test
    void providerThrowingSynchronouslyIsContained() {
        PosterProvider broken = mock(PosterProvider.class);
        given(broken.getName()).willReturn("broken");
        given(broken.getPriority()).willReturn(1);
        given(broken.isEnabled()).willReturn(true);
        given(broken.isAvailable()).willReturn(true);
        given(broken.fetch("1", "X")).willThrow(new IllegalStateException("bug"));
        chain.registerProvider(broken);

        FallbackResult result = chain.fetch("1", "X").join();

        assertThat(result.sourceName()).isEqualTo(FallbackResult.ALL_SOURCES_FAILED);
        assertThat(globalMetrics.sourceBreakdown().get("broken").failure()).isEqualTo(1);
    }

    @Test
    void healthCheckAllReportsEachProvider() {
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.notFound("kitsu"), 1, scheduler, clock));
        PosterProvider down = mock(PosterProvider.class);
        given(down.getName()).willReturn("tmdb");
        given(down.healthCheck()).willReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));
        chain.registerProvider(down);

        Map<String, ProviderHealth> health = chain.healthCheckAll().join();

        assertThat(health).containsOnlyKeys("kitsu", "tmdb");
        assertThat(health.get("kitsu").healthy()).isTrue();
        assertThat(health.get("tmdb").healthy()).isFalse();
        assertThat(health.get("tmdb").error()).contains("offline");
    }

    @Test
    void statsIncludeConfigurationAndMetrics() {
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.notFound("kitsu"), 4, scheduler, clock));

        ProviderStatus status = chain.stats().get("kitsu");

        assertThat(status.priority()).isEqualTo(4);
        assertThat(status.timeoutMs()).isEqualTo(2000);
        assertThat(status.enabled()).isTrue();
        assertThat(status.available()).isTrue();
        assertThat(status.metrics().totalRequests()).isZero();
    }

    @Test
    void validateProvidersReportsMissingConfiguredNames() {
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.notFound("kitsu"), 1, scheduler, clock));

        assertThat(chain.validateProviders(List.of("kitsu", "nautiljon"))).containsExactly("nautiljon");
    }

    @Test
    void setProviderEnabledReportsUnknownNames() {
        chain.registerProvider(ProviderFixtures.guarded(StubPosterSource.notFound("kitsu"), 1, scheduler, clock));

        assertThat(chain.setProviderEnabled("kitsu", false)).isTrue();
        assertThat(chain.getProvider("kitsu")).map(PosterProvider::isEnabled).contains(false);
        assertThat(chain.setProviderEnabled("missing", false)).isFalse();
    }

    @Test
    void priorityChangeReordersNextFetch() {
        List<String> attempts = new ArrayList<>();
        chain.registerProvider(recording("p1", 1, attempts));
        chain.registerProvider(recording("p2", 2, attempts));
        chain.fetch("1", "X").join();

        Optional<PosterProvider> updated = chain.updateProviderConfig("p2", new ProviderConfigUpdate(0, null, null));
        attempts.clear();
        chain.fetch("1", "X").join();

        assertThat(updated).map(PosterProvider::getPriority).contains(0);
        assertThat(attempts).containsExactly("p2", "p1");
        assertThat(chain.updateProviderConfig("missing", new ProviderConfigUpdate(1, null, null))).isEmpty();
    }

    private PosterProvider recording(String name, int priority, List<String> attempts) {
        StubPosterSource source = StubPosterSource.answering(name, () -> {
            attempts.add(name);
            return CompletableFuture.completedFuture(Optional.empty());
        });
        return ProviderFixtures.guarded(source, priority, scheduler, clock);
    }
}
