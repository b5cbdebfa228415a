package com.locofleet.common.exception;

/**
 * Exception thrown when a recovery action against an instance fails.
 */
public class RecoveryActionException extends FleetException {

    private final String instanceId;
    private final String action;

    public RecoveryActionException(String message, String instanceId, String action) {
        super(message);
        this.instanceId = instanceId;
        this.action = action;
    }

    public RecoveryActionException(String message, String instanceId, String action, Throwable cause) {
        super(message, cause);
        this.instanceId = instanceId;
        this.action = action;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getAction() {
        return action;
    }
}
