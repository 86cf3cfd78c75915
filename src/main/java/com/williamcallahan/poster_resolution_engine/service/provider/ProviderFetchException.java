/**
 * Exception raised when a poster provider attempt fails
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the provider name and an error kind for metrics and breaker accounting
 * - Unchecked so it travels through CompletableFuture chains unchanged
 */

package com.williamcallahan.poster_resolution_engine.service.provider;

import com.williamcallahan.poster_resolution_engine.types.ProviderErrorKind;

import java.util.concurrent.CompletionException;

public class ProviderFetchException extends RuntimeException {

    private final String providerName;
    private final ProviderErrorKind kind;

    public ProviderFetchException(String providerName, ProviderErrorKind kind, String message) {
        super(message);
        this.providerName = providerName;
        this.kind = kind;
    }

    public ProviderFetchException(String providerName, ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.kind = kind;
    }

    public String getProviderName() {
        return providerName;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    /**
     * Strips CompletionException wrappers and classifies anything else as a transport failure
     */
    public static ProviderFetchException from(String providerName, Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderFetchException providerFetchException) {
            return providerFetchException;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderFetchException(providerName, ProviderErrorKind.TRANSPORT_FAILURE, message, cause);
    }
}
