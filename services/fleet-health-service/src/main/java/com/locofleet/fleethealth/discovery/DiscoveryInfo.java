package com.locofleet.fleethealth.discovery;

import com.locofleet.common.resilience.BreakerState;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class DiscoveryInfo {
    String namespace;
    String labelSelector;
    Instant lastFetch;
    int cachedInstances;
    SnapshotSource source;
    Duration cacheTtl;
    boolean watchActive;
    BreakerState breakerState;
    ClusterInfo cluster;
}
