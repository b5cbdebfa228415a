package com.locofleet.fleethealth.scheduling;

import com.locofleet.common.concurrent.SingleFlightGuard;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.ChangeStream;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.probe.ConnectivityProber;
import com.locofleet.fleethealth.probe.HealthProber;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Drives the three monitoring cadences: fast connectivity probe, deep health cycle and
 * discovery refresh. Each cadence has its own single-flight guard, so a tick that arrives
 * while the previous run of that cadence is still busy is skipped.
 */
@Slf4j
@Component
public class FleetMonitorScheduler {

    private final DiscoveryCache discoveryCache;
    private final HealthProber healthProber;
    private final ConnectivityProber connectivityProber;
    private final FleetMonitorProperties properties;
    private final Executor taskExecutor;

    private final SingleFlightGuard connectivityGuard = new SingleFlightGuard("connectivity-probe");
    private final SingleFlightGuard healthGuard = new SingleFlightGuard("deep-health");
    private final SingleFlightGuard discoveryGuard = new SingleFlightGuard("discovery-refresh");

    private volatile boolean running;
    private volatile ChangeStream changeStream;

    public FleetMonitorScheduler(DiscoveryCache discoveryCache,
                                 HealthProber healthProber,
                                 ConnectivityProber connectivityProber,
                                 FleetMonitorProperties properties,
                                 @Qualifier("fleetTaskExecutor") Executor taskExecutor) {
        this.discoveryCache = discoveryCache;
        this.healthProber = healthProber;
        this.connectivityProber = connectivityProber;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting fleet monitoring (connectivity every {}, deep health every {}, discovery every {})",
            properties.getConnectivity().getInterval(), properties.getHealth().getInterval(),
            properties.getDiscovery().getRefreshInterval());
        discoveryCache.discoverInstances();
        if (properties.getDiscovery().isWatchEnabled()) {
            changeStream = discoveryCache.watch(event ->
                log.debug("Instance {} {}", event.getResourceName(), event.getType()));
        }
        running = true;
    }

    @PreDestroy
    public void stop() {
        running = false;
        ChangeStream stream = changeStream;
        if (stream != null) {
            stream.close();
        }
        log.info("Fleet monitoring stopped");
    }

    @Scheduled(fixedRateString = "#{@fleetMonitorProperties.connectivity.interval.toMillis()}")
    public void runConnectivityProbe() {
        if (running && properties.getConnectivity().isEnabled()) {
            connectivityGuard.trySubmit(taskExecutor, connectivityProber::probeAll);
        }
    }

    @Scheduled(fixedRateString = "#{@fleetMonitorProperties.health.interval.toMillis()}")
    public void runHealthChecks() {
        if (running && properties.getHealth().isEnabled()) {
            healthGuard.trySubmit(taskExecutor, healthProber::performHealthChecks);
        }
    }

    @Scheduled(fixedRateString = "#{@fleetMonitorProperties.discovery.refreshInterval.toMillis()}")
    public void runDiscoveryRefresh() {
        if (running && properties.getDiscovery().isRefreshEnabled()) {
            discoveryGuard.trySubmit(taskExecutor, discoveryCache::refreshDiscovery);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isWatchActive() {
        ChangeStream stream = changeStream;
        return stream != null && stream.isActive();
    }
}
