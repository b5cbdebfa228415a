package com.locofleet.fleethealth.api;

import com.locofleet.common.resilience.BreakerMetrics;
import com.locofleet.common.resilience.BreakerState;
import com.locofleet.common.resilience.BreakerSummary;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BreakersResponse {
    BreakerSummary summary;
    Map<String, BreakerState> open;
    Map<String, BreakerMetrics> metrics;
}
