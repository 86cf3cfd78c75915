package com.williamcallahan.poster_resolution_engine.types;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Raw poster lookup against one external service
 *
 * @author William Callahan
 *
 * Features:
 * - Transport-only contract; throttling, timeouts and circuit breaking are applied by the caller
 * - An empty Optional means the service answered but had no poster
 * - Transport, parse and auth errors complete the future exceptionally
 */
public interface PosterSource {

    /**
     * @return stable provider name used in configuration and statistics
     */
    String getName();

    /**
     * Looks up a poster URL for an item
     *
     * @param itemId catalog identifier of the item
     * @param itemName display name of the item, used by title-search services
     * @return future with the poster URL, or empty when the service has none
     */
    CompletableFuture<Optional<String>> fetchPoster(String itemId, String itemName);

    /**
     * @return future completing with true when the service is reachable
     */
    CompletableFuture<Boolean> healthCheck();
}
