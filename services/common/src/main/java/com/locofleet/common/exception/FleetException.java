package com.locofleet.common.exception;

/**
 * Base class for all fleet monitoring failures.
 */
public class FleetException extends RuntimeException {

    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
