package com.locofleet.fleethealth.scheduling;

import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.ChangeStream;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.HealthProber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FleetMonitorScheduler Unit Tests")
class FleetMonitorSchedulerTest {

    @Mock
    private DiscoveryCache discoveryCache;

    @Mock
    private HealthProber healthProber;

    @Mock
    private ConnectivityProber connectivityProber;

    @Mock
    private ChangeStream changeStream;

    private FleetMonitorProperties properties;
    private final List<Runnable> queued = new ArrayList<>();
    private final Executor queueingExecutor = queued::add;

    @BeforeEach
    void setUp() {
        properties = new FleetMonitorProperties();
    }

    private FleetMonitorScheduler scheduler(Executor executor) {
        return new FleetMonitorScheduler(discoveryCache, healthProber, connectivityProber, properties, executor);
    }

    @Test
    @DisplayName("performs an initial discovery and opens the watch on startup")
    void shouldStartMonitoring() {
        // Given
        when(discoveryCache.watch(any())).thenReturn(changeStream);
        when(changeStream.isActive()).thenReturn(true);
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);

        // When
        scheduler.start();

        // Then
        verify(discoveryCache).discoverInstances();
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.isWatchActive()).isTrue();
    }

    @Test
    @DisplayName("skips the watch when it is disabled")
    void shouldNotWatchWhenDisabled() {
        properties.getDiscovery().setWatchEnabled(false);
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);

        scheduler.start();

        verify(discoveryCache, never()).watch(any());
        assertThat(scheduler.isWatchActive()).isFalse();
    }

    @Test
    @DisplayName("ignores ticks before startup")
    void shouldIgnoreTicksBeforeStart() {
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);

        scheduler.runHealthChecks();
        scheduler.runConnectivityProbe();
        scheduler.runDiscoveryRefresh();

        verifyNoInteractions(healthProber, connectivityProber, discoveryCache);
    }

    @Test
    @DisplayName("runs each enabled cadence on the task executor")
    void shouldRunCadences() {
        // Given
        properties.getDiscovery().setWatchEnabled(false);
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);
        scheduler.start();

        // When
        scheduler.runHealthChecks();
        scheduler.runConnectivityProbe();
        scheduler.runDiscoveryRefresh();

        // Then
        verify(healthProber).performHealthChecks();
        verify(connectivityProber).probeAll();
        verify(discoveryCache).refreshDiscovery();
    }

    @Test
    @DisplayName("skips a cadence that is disabled")
    void shouldSkipDisabledCadence() {
        // Given
        properties.getDiscovery().setWatchEnabled(false);
        properties.getHealth().setEnabled(false);
        properties.getConnectivity().setEnabled(false);
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);
        scheduler.start();

        // When
        scheduler.runHealthChecks();
        scheduler.runConnectivityProbe();

        // Then
        verifyNoInteractions(healthProber, connectivityProber);
    }

    @Test
    @DisplayName("skips a tick while the previous run of the same cadence is still in flight")
    void shouldNotOverlapRuns() {
        // Given
        properties.getDiscovery().setWatchEnabled(false);
        FleetMonitorScheduler scheduler = scheduler(queueingExecutor);
        scheduler.start();

        // When
        scheduler.runHealthChecks();
        scheduler.runHealthChecks();
        scheduler.runConnectivityProbe();

        // Then
        assertThat(queued).hasSize(2);
        queued.forEach(Runnable::run);
        verify(healthProber, times(1)).performHealthChecks();
        verify(connectivityProber, times(1)).probeAll();

        // When
        queued.clear();
        scheduler.runHealthChecks();

        // Then
        assertThat(queued).hasSize(1);
    }

    @Test
    @DisplayName("closes the change stream on shutdown")
    void shouldCloseStreamOnStop() {
        when(discoveryCache.watch(any())).thenReturn(changeStream);
        FleetMonitorScheduler scheduler = scheduler(Runnable::run);
        scheduler.start();

        scheduler.stop();

        verify(changeStream).close();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
