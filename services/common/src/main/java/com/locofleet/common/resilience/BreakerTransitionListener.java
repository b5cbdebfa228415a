package com.locofleet.common.resilience;

/**
 * Receives every breaker state change. Invoked on the thread that caused the transition.
 */
@FunctionalInterface
public interface BreakerTransitionListener {

    void onTransition(String breakerName, BreakerState from, BreakerState to);
}
