package com.locofleet.fleethealth.discovery;

import io.fabric8.kubernetes.api.model.Pod;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

/**
 * Operations consumed from the cluster orchestrator.
 */
public interface OrchestratorClient {

    /**
     * Lists the raw instance objects matching every label in {@code selector}.
     *
     * @throws com.locofleet.common.exception.DiscoveryUnavailableException when the orchestrator cannot be queried
     */
    List<Pod> listInstances(Map<String, String> selector);

    /**
     * Lists the controllers that own fleet instances.
     *
     * @throws com.locofleet.common.exception.DiscoveryUnavailableException when the orchestrator cannot be queried
     */
    List<WorkloadInfo> listWorkloads(Map<String, String> selector);

    /**
     * Lists the services fronting the fleet.
     *
     * @throws com.locofleet.common.exception.DiscoveryUnavailableException when the orchestrator cannot be queried
     */
    List<ServiceEndpointInfo> listServices(Map<String, String> selector);

    /**
     * Opens a change-notification channel.
     *
     * @return handle that stops the watch when closed
     * @throws UnsupportedOperationException when the orchestrator offers no watch support
     */
    Closeable watch(Map<String, String> selector, OrchestratorWatchListener listener);

    /**
     * Deletes an instance so its controller recreates it. Deleting an absent instance succeeds.
     *
     * @return true if an object was deleted
     */
    boolean deleteInstance(String resourceName);

    String getNamespace();
}
