package com.locofleet.fleethealth.discovery;

import lombok.Value;

import java.time.Instant;

/**
 * Change notification for one orchestrator object. Carries no instance data: consumers
 * re-read the snapshot, which is refreshed on the next discovery call.
 */
@Value
public class InstanceChangeEvent {
    ChangeType type;
    String resourceName;
    Instant receivedAt;
}
