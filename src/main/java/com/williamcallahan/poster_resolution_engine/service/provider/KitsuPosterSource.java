package com.williamcallahan.poster_resolution_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.poster_resolution_engine.config.PosterResolutionProperties;
import com.williamcallahan.poster_resolution_engine.types.PosterSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Poster lookups against the Kitsu anime API
 *
 * @author William Callahan
 *
 * Features:
 * - Looks up items by numeric Kitsu ID
 * - Prefers the large poster rendition, then medium, then original
 * - A 404 or a non-numeric ID is "not found"; other HTTP errors fail the future
 */
@Component
public class KitsuPosterSource implements PosterSource {

    private static final Logger logger = LoggerFactory.getLogger(KitsuPosterSource.class);

    public static final String NAME = "kitsu";
    static final String DEFAULT_BASE_URL = "https://kitsu.io/api/edge";
    private static final String JSON_API = "application/vnd.api+json";
    private static final String HEALTH_CHECK_ID = "1";

    private final WebClient webClient;

    @Autowired
    public KitsuPosterSource(WebClient.Builder webClientBuilder, PosterResolutionProperties properties) {
        this(webClientBuilder.clone()
                .baseUrl(baseUrl(properties))
                .defaultHeader("Accept", JSON_API)
                .build());
    }

    public KitsuPosterSource(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public CompletableFuture<Optional<String>> fetchPoster(String itemId, String itemName) {
        if (itemId == null || !itemId.matches("\\d+")) {
            logger.debug("Kitsu lookup skipped for non-numeric ID '{}'", itemId);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return webClient.get()
            .uri("/anime/{id}", itemId)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::extractPosterUrl)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                logger.debug("Kitsu has no anime with ID {}", itemId);
                return Mono.just(Optional.empty());
            })
            .defaultIfEmpty(Optional.empty())
            .toFuture();
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return webClient.get()
            .uri("/anime/{id}", HEALTH_CHECK_ID)
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .onErrorResume(e -> {
                logger.warn("Kitsu health check failed: {}", e.getMessage());
                return Mono.just(false);
            })
            .defaultIfEmpty(false)
            .toFuture();
    }

    Optional<String> extractPosterUrl(JsonNode body) {
        JsonNode poster = body.path("data").path("attributes").path("posterImage");
        for (String size : new String[] {"large", "medium", "original"}) {
            JsonNode url = poster.path(size);
            if (url.isTextual() && !url.asText().isBlank()) {
                return Optional.of(url.asText());
            }
        }
        return Optional.empty();
    }

    private static String baseUrl(PosterResolutionProperties properties) {
        PosterResolutionProperties.Provider provider = properties.getProviders().get(NAME);
        return provider != null && provider.getBaseUrl() != null ? provider.getBaseUrl() : DEFAULT_BASE_URL;
    }
}
