package com.williamcallahan.poster_resolution_engine.types;

import java.util.Objects;

/**
 * Composite identifier for a poster lookup
 * - Addresses cache entries and in-flight deduplication through {@link #value()}
 *
 * @author William Callahan
 */
public record ResolutionKey(String itemId, String itemName) {

    public ResolutionKey {
        Objects.requireNonNull(itemId, "itemId");
        itemName = itemName == null ? "" : itemName;
    }

    /**
     * @return the composite form {@code itemId:itemName}
     */
    public String value() {
        return itemId + ":" + itemName;
    }

    @Override
    public String toString() {
        return value();
    }
}
