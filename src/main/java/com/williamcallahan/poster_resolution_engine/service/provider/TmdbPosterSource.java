package com.williamcallahan.poster_resolution_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.poster_resolution_engine.config.PosterResolutionProperties;
import com.williamcallahan.poster_resolution_engine.types.PosterSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Poster lookups against The Movie Database search API
 *
 * @author William Callahan
 *
 * Features:
 * - Searches by cleaned title, first as a TV show and then as a movie
 * - Returns the first result carrying a poster path, on the w500 image base
 * - Requires an API key; lookups without one fail
 */
@Component
public class TmdbPosterSource implements PosterSource {

    private static final Logger logger = LoggerFactory.getLogger(TmdbPosterSource.class);

    public static final String NAME = "tmdb";
    static final String DEFAULT_BASE_URL = "https://api.themoviedb.org/3";
    static final String IMAGE_BASE_URL = "https://image.tmdb.org/t/p/w500";
    private static final String LANGUAGE = "fr-FR";

    private final WebClient webClient;
    private final String apiKey;

    @Autowired
    public TmdbPosterSource(WebClient.Builder webClientBuilder, PosterResolutionProperties properties) {
        this(webClientBuilder.clone().baseUrl(baseUrl(properties)).build(), apiKey(properties));
    }

    public TmdbPosterSource(WebClient webClient, String apiKey) {
        this.webClient = webClient;
        this.apiKey = apiKey;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<Optional<String>> fetchPoster(String itemId, String itemName) {
        if (!hasApiKey()) {
            return CompletableFuture.failedFuture(new IllegalStateException("TMDB API key is not configured"));
        }
        String query = cleanTitle(itemName);
        if (query.isEmpty()) {
            logger.debug("TMDB lookup skipped for item {} without a usable title", itemId);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return search("tv", query)
            .flatMap(tvPoster -> tvPoster.isPresent() ? Mono.just(tvPoster) : search("movie", query))
            .defaultIfEmpty(Optional.empty())
            .toFuture();
    }

    private Mono<Optional<String>> search(String type, String query) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search/{type}")
                .queryParam("api_key", apiKey)
                .queryParam("query", query)
                .queryParam("language", LANGUAGE)
                .build(type))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::firstPoster)
            .defaultIfEmpty(Optional.empty());
    }

    Optional<String> firstPoster(JsonNode body) {
        for (JsonNode result : body.path("results")) {
            JsonNode posterPath = result.path("poster_path");
            if (posterPath.isTextual() && !posterPath.asText().isBlank()) {
                return Optional.of(IMAGE_BASE_URL + posterPath.asText());
            }
        }
        return Optional.empty();
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        if (!hasApiKey()) {
            logger.warn("TMDB health check skipped: API key missing");
            return CompletableFuture.completedFuture(false);
        }
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/configuration").queryParam("api_key", apiKey).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(body -> body.path("images").path("base_url").isTextual())
            .onErrorResume(e -> {
                logger.warn("TMDB health check failed: {}", e.getMessage());
                return Mono.just(false);
            })
            .defaultIfEmpty(false)
            .toFuture();
    }

    /**
     * Strips bracketed qualifiers and season markers that hurt title search
     */
    static String cleanTitle(String title) {
        if (title == null) {
            return "";
        }
        return title
            .replaceAll("\\s*\\([^)]*\\)", "")
            .replaceAll("\\s*\\[[^\\]]*\\]", "")
            .replaceAll("(?i)\\s*saison\\s*\\d+", "")
            .replaceAll("(?i)\\s*season\\s*\\d+", "")
            .replaceAll("(?i)\\s+s\\d+\\b", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    private static String baseUrl(PosterResolutionProperties properties) {
        PosterResolutionProperties.Provider provider = properties.getProviders().get(NAME);
        return provider != null && provider.getBaseUrl() != null ? provider.getBaseUrl() : DEFAULT_BASE_URL;
    }

    private static String apiKey(PosterResolutionProperties properties) {
        PosterResolutionProperties.Provider provider = properties.getProviders().get(NAME);
        return provider != null ? provider.getApiKey() : null;
    }
}
