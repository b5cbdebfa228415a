package com.locofleet.fleethealth.probe;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProbeMetrics {
    long totalChecks;
    long successfulChecks;
    long failedChecks;
    double averageResponseTimeMs;
    Instant uptimeStart;

    /**
     * Percentage of successful checks, 100 before the first check.
     */
    public double getSuccessRate() {
        return totalChecks > 0 ? (successfulChecks * 100.0) / totalChecks : 100.0;
    }
}
