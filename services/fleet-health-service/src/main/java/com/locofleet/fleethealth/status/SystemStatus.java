package com.locofleet.fleethealth.status;

import com.locofleet.common.resilience.BreakerState;
import com.locofleet.common.resilience.BreakerSummary;
import com.locofleet.fleethealth.discovery.SnapshotSource;
import com.locofleet.fleethealth.probe.ConnectivitySummary;
import com.locofleet.fleethealth.probe.HealthHistoryEntry;
import com.locofleet.fleethealth.recovery.RecoveryStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SystemStatus {
    String status;
    Instant startedAt;
    long uptimeSeconds;
    int instances;
    SnapshotSource discoverySource;
    long totalChecks;
    long successfulChecks;
    long failedChecks;
    double successRate;
    double averageResponseTimeMs;
    Map<String, BreakerState> openBreakers;
    BreakerSummary breakerSummary;
    ConnectivitySummary connectivity;
    Map<String, RecoveryStatus> recovery;
    Map<String, List<HealthHistoryEntry>> history;
}
