package com.locofleet.fleethealth.recovery;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class RecoveryRecord {

    @Builder.Default
    int attempts = 0;

    @Builder.Default
    RecoveryState state = RecoveryState.HEALTHY;

    @Builder.Default
    FailureType lastFailureType = FailureType.NONE;

    Instant updatedAt;
}
