package com.locofleet.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Externally visible breaker states.
 */
public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static BreakerState from(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
