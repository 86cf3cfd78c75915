package com.williamcallahan.poster_resolution_engine.testutil;

import com.williamcallahan.poster_resolution_engine.types.PosterSource;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Scriptable poster source that counts its invocations. */
public final class StubPosterSource implements PosterSource {

    private final String name;
    private volatile Supplier<CompletableFuture<Optional<String>>> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    private StubPosterSource(String name, Supplier<CompletableFuture<Optional<String>>> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    public static StubPosterSource returning(String name, String url) {
        return new StubPosterSource(name, () -> CompletableFuture.completedFuture(Optional.of(url)));
    }

    public static StubPosterSource notFound(String name) {
        return new StubPosterSource(name, () -> CompletableFuture.completedFuture(Optional.empty()));
    }

    public static StubPosterSource failing(String name) {
        return new StubPosterSource(name,
            () -> CompletableFuture.failedFuture(new IllegalStateException(name + " transport error")));
    }

    public static StubPosterSource hanging(String name) {
        return new StubPosterSource(name, CompletableFuture::new);
    }

    public static StubPosterSource answering(String name, Supplier<CompletableFuture<Optional<String>>> behaviour) {
        return new StubPosterSource(name, behaviour);
    }

    public void willReturn(String url) {
        behaviour = () -> CompletableFuture.completedFuture(Optional.of(url));
    }

    public void willFindNothing() {
        behaviour = () -> CompletableFuture.completedFuture(Optional.empty());
    }

    public void willFail() {
        behaviour = () -> CompletableFuture.failedFuture(new IllegalStateException(name + " transport error"));
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<Optional<String>> fetchPoster(String itemId, String itemName) {
        calls.incrementAndGet();
        return behaviour.get();
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.completedFuture(true);
    }
}
