package com.locofleet.common.exception;

/**
 * Exception thrown when a breaker is open and has no fallback to return.
 */
public class BreakerOpenException extends FleetException {

    private final String breakerName;

    public BreakerOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }

    public BreakerOpenException(String breakerName, Throwable cause) {
        super("Circuit breaker '" + breakerName + "' is open", cause);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
