package com.locofleet.fleethealth.recovery;

import com.locofleet.common.exception.FleetException;
import com.locofleet.common.exception.RecoveryActionException;
import com.locofleet.common.resilience.Breaker;
import com.locofleet.common.resilience.BreakerSettings;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.FleetInstance;
import com.locofleet.fleethealth.discovery.OrchestratorClient;
import com.locofleet.fleethealth.probe.InstanceAgentClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Network recovery goes through the instance agent; subsystem recovery deletes the pod so
 * its StatefulSet recreates it with a fresh emulator.
 */
@Slf4j
@Component
public class FleetRecoveryActions implements RecoveryActions {

    public static final String DELETE_BREAKER = "orchestrator.delete-instance";

    private final InstanceAgentClient agentClient;
    private final DiscoveryCache discoveryCache;
    private final Breaker<String, Boolean> deleteBreaker;

    public FleetRecoveryActions(InstanceAgentClient agentClient,
                                OrchestratorClient orchestratorClient,
                                DiscoveryCache discoveryCache,
                                CallGateway callGateway,
                                FleetMonitorProperties properties) {
        this.agentClient = agentClient;
        this.discoveryCache = discoveryCache;
        this.deleteBreaker = callGateway.createBreaker(DELETE_BREAKER,
            orchestratorClient::deleteInstance,
            BreakerSettings.builder()
                .callTimeout(properties.getDiscovery().getRequestTimeout())
                .build());
    }

    @Override
    public void recoverNetwork(FleetInstance instance) {
        agentClient.requestNetworkRecovery(instance);
    }

    @Override
    public void recoverSubsystem(FleetInstance instance) {
        try {
            boolean deleted = deleteBreaker.fire(instance.getResourceName());
            if (deleted) {
                log.info("Deleted pod {} of {} for recreation", instance.getResourceName(), instance.getId());
            } else {
                log.info("Pod {} of {} already gone", instance.getResourceName(), instance.getId());
            }
            discoveryCache.invalidate();
        } catch (FleetException e) {
            throw new RecoveryActionException("Failed to restart " + instance.getResourceName() + ": " + e.getMessage(),
                instance.getId(), "subsystem", e);
        }
    }
}
