package com.locofleet.common.exception;

/**
 * Exception thrown when an instance health endpoint cannot be read.
 */
public class HealthProbeException extends FleetException {

    private final String instanceId;
    private final int statusCode;

    public HealthProbeException(String message, String instanceId) {
        this(message, instanceId, -1, null);
    }

    public HealthProbeException(String message, String instanceId, int statusCode) {
        this(message, instanceId, statusCode, null);
    }

    public HealthProbeException(String message, String instanceId, Throwable cause) {
        this(message, instanceId, -1, cause);
    }

    public HealthProbeException(String message, String instanceId, int statusCode, Throwable cause) {
        super(message, cause);
        this.instanceId = instanceId;
        this.statusCode = statusCode;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
