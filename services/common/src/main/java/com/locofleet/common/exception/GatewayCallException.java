package com.locofleet.common.exception;

/**
 * Exception thrown when a call protected by a breaker fails and no fallback is configured.
 */
public class GatewayCallException extends FleetException {

    private final String breakerName;
    private final boolean timeout;

    public GatewayCallException(String breakerName, Throwable cause) {
        this(breakerName, false, cause);
    }

    public GatewayCallException(String breakerName, boolean timeout, Throwable cause) {
        super("Call through breaker '" + breakerName + "' failed: "
            + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.breakerName = breakerName;
        this.timeout = timeout;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
