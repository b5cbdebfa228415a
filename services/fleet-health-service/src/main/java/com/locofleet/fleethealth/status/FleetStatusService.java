package com.locofleet.fleethealth.status;

import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.DiscoverySnapshot;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.HealthProber;
import com.locofleet.fleethealth.probe.ProbeMetrics;
import com.locofleet.fleethealth.recovery.RecoveryOrchestrator;
import com.locofleet.fleethealth.scheduling.FleetMonitorScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Read-only aggregate of the monitoring state for API and dashboards.
 */
@Service
@RequiredArgsConstructor
public class FleetStatusService {

    private final DiscoveryCache discoveryCache;
    private final HealthProber healthProber;
    private final ConnectivityProber connectivityProber;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final CallGateway callGateway;
    private final FleetMonitorScheduler scheduler;
    private final Clock clock;

    public SystemStatus getSystemStatus() {
        ProbeMetrics metrics = healthProber.getMetrics();
        DiscoverySnapshot snapshot = discoveryCache.getInstances();
        return SystemStatus.builder()
            .status(scheduler.isRunning() ? "running" : "stopped")
            .startedAt(metrics.getUptimeStart())
            .uptimeSeconds(Duration.between(metrics.getUptimeStart(), clock.instant()).toSeconds())
            .instances(snapshot.size())
            .discoverySource(snapshot.getSource())
            .totalChecks(metrics.getTotalChecks())
            .successfulChecks(metrics.getSuccessfulChecks())
            .failedChecks(metrics.getFailedChecks())
            .successRate(metrics.getSuccessRate())
            .averageResponseTimeMs(metrics.getAverageResponseTimeMs())
            .openBreakers(callGateway.openBreakers())
            .breakerSummary(callGateway.getSummary())
            .connectivity(connectivityProber.getSummary())
            .recovery(recoveryOrchestrator.getRecoveryStatus())
            .history(healthProber.getAllHistory())
            .build();
    }
}
