package com.williamcallahan.poster_resolution_engine.types;

/**
 * Classification of a failed provider attempt
 *
 * @author William Callahan
 *
 * Features:
 * - Only {@link #TIMEOUT} and {@link #TRANSPORT_FAILURE} count against the circuit breaker
 * - {@link #NOT_FOUND} is reporting-only; a miss is an empty result, not an error
 */
public enum ProviderErrorKind {
    UNAVAILABLE("unavailable"),
    TIMEOUT("timeout"),
    NOT_FOUND("not_found"),
    TRANSPORT_FAILURE("transport_failure");

    private final String tag;

    ProviderErrorKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean countsAsFailure() {
        return this == TIMEOUT || this == TRANSPORT_FAILURE;
    }
}
