package com.williamcallahan.poster_resolution_engine.types;

/**
 * Circuit breaker states for a poster provider
 *
 * @author William Callahan
 */
public enum CircuitState {
    CLOSED,     // Normal operation
    OPEN,       // Rejecting attempts until the cooldown elapses
    HALF_OPEN   // One trial attempt in flight
}
