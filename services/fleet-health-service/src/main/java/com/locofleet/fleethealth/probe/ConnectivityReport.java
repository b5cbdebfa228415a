package com.locofleet.fleethealth.probe;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of the fast connectivity probe of one instance.
 */
@Value
@Builder
public class ConnectivityReport {
    String instanceId;
    Instant checkedAt;
    ProbeStatus displayStatus;
    /** Version from the RFB banner, e.g. {@code 003.008}. */
    String rfbVersion;
    long displayLatencyMs;
    ProbeStatus healthStatus;
    Integer healthHttpStatus;
    long healthLatencyMs;
    String error;

    /**
     * Reachable when either the display port or the health endpoint answered correctly.
     */
    public boolean isReachable() {
        return displayStatus == ProbeStatus.OK || healthStatus == ProbeStatus.OK;
    }
}
