package com.locofleet.fleethealth.api;

import com.locofleet.common.exception.FleetException;

/**
 * Requested instance is not in the current discovery snapshot.
 * Results in HTTP 404 Not Found
 */
public class InstanceNotFoundException extends FleetException {

    private final String instanceId;

    public InstanceNotFoundException(String instanceId) {
        super("Instance not found: " + instanceId);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
