package com.locofleet.fleethealth.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * <pre>
 * HEALTHY -> RECOVERY_PENDING            failure detected, attempt dispatched
 * RECOVERY_PENDING -> HEALTHY            action succeeded or healthy probe
 * RECOVERY_PENDING -> RECOVERY_EXHAUSTED attempts reached the maximum
 * RECOVERY_EXHAUSTED -> HEALTHY          healthy probe or manual reset
 * </pre>
 */
public enum RecoveryState {
    HEALTHY,
    RECOVERY_PENDING,
    RECOVERY_EXHAUSTED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
