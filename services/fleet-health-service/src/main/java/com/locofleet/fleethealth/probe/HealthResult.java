package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.locofleet.fleethealth.recovery.FailureClassification;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one probe of one instance.
 */
@Value
@Builder
public class HealthResult {

    String instanceId;
    Instant timestamp;
    HealthStatus status;
    long responseTimeMs;

    @JsonIgnore
    HealthPayload payload;

    HealthAnalysis analysis;
    FailureClassification classification;
    String error;

    public static HealthResult breakerOpen(String instanceId, Instant timestamp) {
        return HealthResult.builder()
            .instanceId(instanceId)
            .timestamp(timestamp)
            .status(HealthStatus.CIRCUIT_BREAKER_OPEN)
            .error("Circuit breaker open")
            .build();
    }

    public static HealthResult error(String instanceId, Instant timestamp, String error) {
        return HealthResult.builder()
            .instanceId(instanceId)
            .timestamp(timestamp)
            .status(HealthStatus.ERROR)
            .error(error)
            .build();
    }

    /**
     * Score of the analysis, null when the payload could not be read.
     */
    public Integer getScore() {
        return analysis != null ? analysis.getScore() : null;
    }
}
