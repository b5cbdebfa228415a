package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    /** Health endpoint answered; the analysis carries the score. */
    HEALTHY,
    /** Health endpoint unreachable, non-2xx or malformed after retries. */
    UNHEALTHY,
    /** The probe itself failed or timed out inside the cycle. */
    ERROR,
    /** Probe skipped without I/O because the instance breaker is open. */
    CIRCUIT_BREAKER_OPEN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
