package com.locofleet.common.exception;

/**
 * Exception thrown when a health payload does not have the expected shape.
 */
public class MalformedHealthPayloadException extends FleetException {

    public MalformedHealthPayloadException(String message) {
        super(message);
    }

    public MalformedHealthPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
