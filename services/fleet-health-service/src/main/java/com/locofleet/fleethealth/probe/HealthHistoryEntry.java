package com.locofleet.fleethealth.probe;

import lombok.Value;

import java.time.Instant;

@Value
public class HealthHistoryEntry {
    Instant timestamp;
    HealthStatus status;
    long responseTimeMs;
    Integer score;

    static HealthHistoryEntry of(HealthResult result) {
        return new HealthHistoryEntry(result.getTimestamp(), result.getStatus(), result.getResponseTimeMs(),
            result.getScore());
    }
}
