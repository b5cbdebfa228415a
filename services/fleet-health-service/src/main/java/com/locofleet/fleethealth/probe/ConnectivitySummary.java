package com.locofleet.fleethealth.probe;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ConnectivitySummary {
    int totalInstances;
    int reachableInstances;
    int displayAvailable;
    double availabilityPercent;
    Instant lastProbeAt;
}
