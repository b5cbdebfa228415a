package com.locofleet.fleethealth.recovery;

import com.locofleet.common.exception.DiscoveryUnavailableException;
import com.locofleet.common.exception.RecoveryActionException;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.FleetInstance;
import com.locofleet.fleethealth.discovery.OrchestratorClient;
import com.locofleet.fleethealth.probe.InstanceAgentClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.concurrent.Executors;

import static com.locofleet.fleethealth.FleetFixtures.instance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FleetRecoveryActions")
class FleetRecoveryActionsTest {

    @Mock
    private InstanceAgentClient agentClient;

    @Mock
    private OrchestratorClient orchestratorClient;

    @Mock
    private DiscoveryCache discoveryCache;

    private CallGateway callGateway;
    private FleetRecoveryActions actions;
    private final FleetInstance target = instance(1);

    @BeforeEach
    void setUp() {
        callGateway = new CallGateway(Executors.newCachedThreadPool(), new SimpleMeterRegistry(), Clock.systemUTC());
        actions = new FleetRecoveryActions(agentClient, orchestratorClient, discoveryCache, callGateway,
            new FleetMonitorProperties());
    }

    @AfterEach
    void tearDown() {
        callGateway.shutdown();
    }

    @Test
    @DisplayName("restarts the emulator by deleting its pod and invalidates discovery")
    void shouldDeletePod() {
        when(orchestratorClient.deleteInstance("loco-emulator-1")).thenReturn(true);

        actions.recoverSubsystem(target);

        verify(orchestratorClient).deleteInstance("loco-emulator-1");
        verify(discoveryCache).invalidate();
    }

    @Test
    @DisplayName("treats an already deleted pod as recovered")
    void shouldAcceptMissingPod() {
        when(orchestratorClient.deleteInstance("loco-emulator-1")).thenReturn(false);

        actions.recoverSubsystem(target);

        verify(discoveryCache).invalidate();
    }

    @Test
    @DisplayName("wraps orchestrator failures as a failed subsystem recovery")
    void shouldWrapOrchestratorFailure() {
        when(orchestratorClient.deleteInstance("loco-emulator-1"))
            .thenThrow(new DiscoveryUnavailableException("forbidden", "loco"));

        assertThatThrownBy(() -> actions.recoverSubsystem(target))
            .isInstanceOfSatisfying(RecoveryActionException.class, e -> {
                assertThat(e.getAction()).isEqualTo("subsystem");
                assertThat(e.getInstanceId()).isEqualTo("instance-1");
            });
        verify(discoveryCache, never()).invalidate();
    }

    @Test
    @DisplayName("delegates network recovery to the instance agent")
    void shouldDelegateNetworkRecovery() {
        actions.recoverNetwork(target);

        verify(agentClient).requestNetworkRecovery(target);
    }
}
