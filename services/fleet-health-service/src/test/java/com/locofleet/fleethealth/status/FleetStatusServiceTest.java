package com.locofleet.fleethealth.status;

import com.locofleet.common.resilience.BreakerState;
import com.locofleet.common.resilience.BreakerSummary;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.DiscoverySnapshot;
import com.locofleet.fleethealth.discovery.SnapshotSource;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.ConnectivitySummary;
import com.locofleet.fleethealth.probe.HealthProber;
import com.locofleet.fleethealth.probe.ProbeMetrics;
import com.locofleet.fleethealth.recovery.RecoveryOrchestrator;
import com.locofleet.fleethealth.scheduling.FleetMonitorScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.locofleet.fleethealth.FleetFixtures.NOW;
import static com.locofleet.fleethealth.FleetFixtures.instance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FleetStatusService")
class FleetStatusServiceTest {

    @Mock
    private DiscoveryCache discoveryCache;

    @Mock
    private HealthProber healthProber;

    @Mock
    private ConnectivityProber connectivityProber;

    @Mock
    private RecoveryOrchestrator recoveryOrchestrator;

    @Mock
    private CallGateway callGateway;

    @Mock
    private FleetMonitorScheduler scheduler;

    @Test
    @DisplayName("aggregates probe metrics, breakers and discovery into one status")
    void shouldAggregateStatus() {
        // Given
        Clock clock = Clock.fixed(NOW.plus(Duration.ofMinutes(5)), ZoneOffset.UTC);
        FleetStatusService service = new FleetStatusService(discoveryCache, healthProber, connectivityProber,
            recoveryOrchestrator, callGateway, scheduler, clock);
        when(scheduler.isRunning()).thenReturn(true);
        when(healthProber.getMetrics()).thenReturn(ProbeMetrics.builder()
            .totalChecks(4)
            .successfulChecks(3)
            .failedChecks(1)
            .averageResponseTimeMs(120.0)
            .uptimeStart(NOW)
            .build());
        when(discoveryCache.getInstances()).thenReturn(DiscoverySnapshot.live(List.of(instance(0), instance(1)), NOW));
        when(callGateway.openBreakers()).thenReturn(Map.of("health-probe:instance-1", BreakerState.OPEN));
        when(callGateway.getSummary()).thenReturn(BreakerSummary.builder().totalBreakers(3).openBreakers(1).build());
        when(connectivityProber.getSummary()).thenReturn(ConnectivitySummary.builder().totalInstances(2).build());
        when(recoveryOrchestrator.getRecoveryStatus()).thenReturn(Map.of());
        when(healthProber.getAllHistory()).thenReturn(Map.of());

        // When
        SystemStatus status = service.getSystemStatus();

        // Then
        assertThat(status.getStatus()).isEqualTo("running");
        assertThat(status.getUptimeSeconds()).isEqualTo(300);
        assertThat(status.getInstances()).isEqualTo(2);
        assertThat(status.getDiscoverySource()).isEqualTo(SnapshotSource.LIVE);
        assertThat(status.getSuccessRate()).isEqualTo(75.0);
        assertThat(status.getFailedChecks()).isEqualTo(1);
        assertThat(status.getOpenBreakers()).containsKey("health-probe:instance-1");
        assertThat(status.getBreakerSummary().getOpenBreakers()).isEqualTo(1);
    }
}
