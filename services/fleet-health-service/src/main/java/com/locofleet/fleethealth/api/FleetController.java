package com.locofleet.fleethealth.api;

import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.DiscoveryInfo;
import com.locofleet.fleethealth.discovery.DiscoverySnapshot;
import com.locofleet.fleethealth.probe.ConnectivityReport;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.HealthCheckCycle;
import com.locofleet.fleethealth.probe.HealthHistoryEntry;
import com.locofleet.fleethealth.probe.HealthProber;
import com.locofleet.fleethealth.recovery.RecoveryOrchestrator;
import com.locofleet.fleethealth.recovery.RecoveryStatus;
import com.locofleet.fleethealth.status.FleetStatusService;
import com.locofleet.fleethealth.status.SystemStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface for fleet discovery, health, connectivity and recovery state
 */
@Slf4j
@RestController
@RequestMapping("/api/fleet")
@RequiredArgsConstructor
public class FleetController {

    private final DiscoveryCache discoveryCache;
    private final HealthProber healthProber;
    private final ConnectivityProber connectivityProber;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final FleetStatusService statusService;
    private final CallGateway callGateway;

    // ============== Discovery ==============

    @GetMapping("/instances")
    public ResponseEntity<DiscoverySnapshot> getInstances() {
        return ResponseEntity.ok(discoveryCache.discoverInstances());
    }

    @PostMapping("/discovery/refresh")
    public ResponseEntity<DiscoverySnapshot> refreshDiscovery() {
        log.info("Manual discovery refresh requested");
        return ResponseEntity.ok(discoveryCache.refreshDiscovery());
    }

    @GetMapping("/discovery")
    public ResponseEntity<DiscoveryInfo> getDiscoveryInfo() {
        return ResponseEntity.ok(discoveryCache.getDiscoveryInfo());
    }

    // ============== Health ==============

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> getStatus() {
        return ResponseEntity.ok(statusService.getSystemStatus());
    }

    @GetMapping("/health/last-cycle")
    public ResponseEntity<HealthCheckCycle> getLastCycle() {
        return healthProber.getLastCycle()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/health/{instanceId}/history")
    public ResponseEntity<List<HealthHistoryEntry>> getHealthHistory(@PathVariable String instanceId) {
        List<HealthHistoryEntry> history = healthProber.getHealthHistory(instanceId);
        if (history.isEmpty() && discoveryCache.findInstance(instanceId).isEmpty()) {
            throw new InstanceNotFoundException(instanceId);
        }
        return ResponseEntity.ok(history);
    }

    @GetMapping("/connectivity")
    public ResponseEntity<Map<String, ConnectivityReport>> getConnectivity() {
        return ResponseEntity.ok(connectivityProber.getLatestReports());
    }

    // ============== Recovery ==============

    @GetMapping("/recovery")
    public ResponseEntity<Map<String, RecoveryStatus>> getRecoveryStatus() {
        return ResponseEntity.ok(recoveryOrchestrator.getRecoveryStatus());
    }

    @PostMapping("/recovery/{instanceId}")
    public ResponseEntity<Map<String, Object>> triggerRecovery(@PathVariable String instanceId) {
        if (discoveryCache.findInstance(instanceId).isEmpty()) {
            throw new InstanceNotFoundException(instanceId);
        }
        log.info("Manual recovery requested for {}", instanceId);
        recoveryOrchestrator.triggerRecovery(instanceId).whenComplete((state, error) -> {
            if (error != null) {
                log.error("Manual recovery of {} failed", instanceId, error);
            } else {
                log.info("Manual recovery of {} finished: {}", instanceId, state);
            }
        });
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("instanceId", instanceId, "accepted", true));
    }

    @PostMapping("/recovery/{instanceId}/reset")
    public ResponseEntity<RecoveryStatus> resetRecovery(@PathVariable String instanceId) {
        log.info("Recovery state reset requested for {}", instanceId);
        recoveryOrchestrator.resetRecovery(instanceId);
        return ResponseEntity.ok(recoveryOrchestrator.getRecoveryStatus(instanceId));
    }

    // ============== Breakers ==============

    @GetMapping("/breakers")
    public ResponseEntity<BreakersResponse> getBreakers() {
        return ResponseEntity.ok(BreakersResponse.builder()
            .summary(callGateway.getSummary())
            .open(callGateway.openBreakers())
            .metrics(callGateway.getAllMetrics())
            .build());
    }
}
