package com.locofleet.fleethealth.recovery;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RecoveryStatus {
    String instanceId;
    int attempts;
    int maxAttempts;
    boolean canRecover;
    RecoveryState state;
    boolean inProgress;
    FailureType lastFailureType;
    Instant updatedAt;
}
