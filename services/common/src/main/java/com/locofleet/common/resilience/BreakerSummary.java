package com.locofleet.common.resilience;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate view over every registered breaker.
 */
@Value
@Builder
public class BreakerSummary {
    int totalBreakers;
    int openBreakers;
    int halfOpenBreakers;
    int closedBreakers;
    long totalRequests;
    long totalFailures;
    double overallErrorRate;
}
