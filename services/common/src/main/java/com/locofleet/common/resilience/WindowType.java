package com.locofleet.common.resilience;

/**
 * How a breaker's failure rate is sampled.
 */
public enum WindowType {

    /**
     * Calls made within the last {@code rollingWindow}.
     */
    TIME_BASED,

    /**
     * The last {@code minimumNumberOfCalls} calls, however far apart. Suits callers that fire
     * on a slow fixed cadence.
     */
    COUNT_BASED
}
