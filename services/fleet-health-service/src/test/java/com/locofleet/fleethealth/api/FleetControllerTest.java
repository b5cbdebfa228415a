package com.locofleet.fleethealth.api;

import com.locofleet.common.exception.FleetException;
import com.locofleet.common.resilience.BreakerState;
import com.locofleet.common.resilience.BreakerSummary;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.discovery.ClusterInfo;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.DiscoveryInfo;
import com.locofleet.fleethealth.discovery.DiscoverySnapshot;
import com.locofleet.fleethealth.discovery.SnapshotSource;
import com.locofleet.fleethealth.discovery.WorkloadInfo;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.HealthHistoryEntry;
import com.locofleet.fleethealth.probe.HealthProber;
import com.locofleet.fleethealth.probe.HealthStatus;
import com.locofleet.fleethealth.recovery.FailureType;
import com.locofleet.fleethealth.recovery.RecoveryOrchestrator;
import com.locofleet.fleethealth.recovery.RecoveryState;
import com.locofleet.fleethealth.recovery.RecoveryStatus;
import com.locofleet.fleethealth.status.FleetStatusService;
import com.locofleet.fleethealth.status.SystemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.locofleet.fleethealth.FleetFixtures.NOW;
import static com.locofleet.fleethealth.FleetFixtures.instance;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("FleetController")
class FleetControllerTest {

    @Mock
    private DiscoveryCache discoveryCache;

    @Mock
    private HealthProber healthProber;

    @Mock
    private ConnectivityProber connectivityProber;

    @Mock
    private RecoveryOrchestrator recoveryOrchestrator;

    @Mock
    private FleetStatusService statusService;

    @Mock
    private CallGateway callGateway;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        FleetController controller = new FleetController(discoveryCache, healthProber, connectivityProber,
            recoveryOrchestrator, statusService, callGateway);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("discovery endpoints")
    class Discovery {

        @Test
        @DisplayName("GET /api/fleet/instances lists the current snapshot")
        void shouldListInstances() throws Exception {
            when(discoveryCache.discoverInstances())
                .thenReturn(DiscoverySnapshot.live(List.of(instance(0), instance(1)), NOW));

            mockMvc.perform(get("/api/fleet/instances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("LIVE"))
                .andExpect(jsonPath("$.instances.length()").value(2))
                .andExpect(jsonPath("$.instances[0].id").value("instance-0"))
                .andExpect(jsonPath("$.instances[1].status").value("ready"));
        }

        @Test
        @DisplayName("GET /api/fleet/discovery includes StatefulSet readiness")
        void shouldDescribeDiscovery() throws Exception {
            when(discoveryCache.getDiscoveryInfo()).thenReturn(DiscoveryInfo.builder()
                .namespace("loco")
                .cachedInstances(3)
                .source(SnapshotSource.LIVE)
                .cluster(ClusterInfo.builder()
                    .available(true)
                    .statefulSets(List.of(WorkloadInfo.builder().name("loco-emulator").replicas(3).readyReplicas(2).build()))
                    .services(List.of())
                    .fetchedAt(NOW)
                    .build())
                .build());

            mockMvc.perform(get("/api/fleet/discovery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.namespace").value("loco"))
                .andExpect(jsonPath("$.cluster.available").value(true))
                .andExpect(jsonPath("$.cluster.readyReplicas").value(2))
                .andExpect(jsonPath("$.cluster.statefulSets[0].fullyReady").value(false));
        }

        @Test
        @DisplayName("POST /api/fleet/discovery/refresh bypasses the cache")
        void shouldRefreshDiscovery() throws Exception {
            when(discoveryCache.refreshDiscovery()).thenReturn(DiscoverySnapshot.empty());

            mockMvc.perform(post("/api/fleet/discovery/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("CACHED_FALLBACK"));

            verify(discoveryCache).refreshDiscovery();
        }
    }

    @Nested
    @DisplayName("health endpoints")
    class Health {

        @Test
        @DisplayName("GET /api/fleet/health/{id}/history returns the recorded entries")
        void shouldReturnHistory() throws Exception {
            when(healthProber.getHealthHistory("instance-0"))
                .thenReturn(List.of(new HealthHistoryEntry(NOW, HealthStatus.HEALTHY, 42L, 100)));

            mockMvc.perform(get("/api/fleet/health/instance-0/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].score").value(100))
                .andExpect(jsonPath("$[0].responseTimeMs").value(42));
        }

        @Test
        @DisplayName("GET /api/fleet/health/{id}/history is 404 for an unknown instance")
        void shouldRejectUnknownInstanceHistory() throws Exception {
            when(healthProber.getHealthHistory("instance-9")).thenReturn(List.of());
            when(discoveryCache.findInstance("instance-9")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/fleet/health/instance-9/history"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("INSTANCE_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/fleet/health/instance-9/history"));
        }

        @Test
        @DisplayName("GET /api/fleet/status returns the aggregated system status")
        void shouldReturnStatus() throws Exception {
            when(statusService.getSystemStatus()).thenReturn(SystemStatus.builder()
                .status("running")
                .instances(3)
                .totalChecks(10)
                .successRate(90.0)
                .build());

            mockMvc.perform(get("/api/fleet/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.instances").value(3))
                .andExpect(jsonPath("$.successRate").value(90.0));
        }
    }

    @Nested
    @DisplayName("recovery endpoints")
    class Recovery {

        @Test
        @DisplayName("POST /api/fleet/recovery/{id} accepts a manual trigger")
        void shouldTriggerRecovery() throws Exception {
            when(discoveryCache.findInstance("instance-0")).thenReturn(Optional.of(instance(0)));
            when(recoveryOrchestrator.triggerRecovery("instance-0"))
                .thenReturn(CompletableFuture.completedFuture(RecoveryState.HEALTHY));

            mockMvc.perform(post("/api/fleet/recovery/instance-0"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.instanceId").value("instance-0"))
                .andExpect(jsonPath("$.accepted").value(true));
        }

        @Test
        @DisplayName("POST /api/fleet/recovery/{id} is 404 for an instance that is not discovered")
        void shouldRejectUnknownInstance() throws Exception {
            when(discoveryCache.findInstance("instance-9")).thenReturn(Optional.empty());

            mockMvc.perform(post("/api/fleet/recovery/instance-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.metadata.instanceId").value("instance-9"));

            verify(recoveryOrchestrator, never()).triggerRecovery(anyString());
        }

        @Test
        @DisplayName("POST /api/fleet/recovery/{id}/reset returns the re-armed status")
        void shouldResetRecovery() throws Exception {
            when(recoveryOrchestrator.getRecoveryStatus("instance-0")).thenReturn(RecoveryStatus.builder()
                .instanceId("instance-0")
                .attempts(0)
                .maxAttempts(3)
                .canRecover(true)
                .state(RecoveryState.HEALTHY)
                .lastFailureType(FailureType.NONE)
                .build());

            mockMvc.perform(post("/api/fleet/recovery/instance-0/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canRecover").value(true))
                .andExpect(jsonPath("$.lastFailureType").value("none"));

            verify(recoveryOrchestrator).resetRecovery("instance-0");
        }
    }

    @Test
    @DisplayName("GET /api/fleet/breakers reports the breaker summary")
    void shouldReportBreakers() throws Exception {
        when(callGateway.getSummary()).thenReturn(BreakerSummary.builder()
            .totalBreakers(2)
            .openBreakers(1)
            .closedBreakers(1)
            .build());
        when(callGateway.openBreakers()).thenReturn(Map.of("health-probe:instance-1", BreakerState.OPEN));
        when(callGateway.getAllMetrics()).thenReturn(Map.of());

        mockMvc.perform(get("/api/fleet/breakers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.openBreakers").value(1))
            .andExpect(jsonPath("$.open['health-probe:instance-1']").value("OPEN"));
    }

    @Nested
    @DisplayName("error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("maps a fleet failure escaping a collaborator to 502")
        void shouldMapFleetFailureToBadGateway() throws Exception {
            when(statusService.getSystemStatus()).thenThrow(new FleetException("history store unavailable"));

            mockMvc.perform(get("/api/fleet/status"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("FLEET_OPERATION_FAILED"))
                .andExpect(jsonPath("$.message").value("history store unavailable"));
        }

        @Test
        @DisplayName("maps an unexpected error to 500 without leaking its message")
        void shouldMapUnexpectedErrorToInternalError() throws Exception {
            when(statusService.getSystemStatus()).thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(get("/api/fleet/status"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
        }
    }
}
