package com.locofleet.fleethealth.discovery;

import com.locofleet.common.exception.DiscoveryUnavailableException;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServiceSpec;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetSpec;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link OrchestratorClient} backed by the fabric8 Kubernetes client, scoped to one namespace.
 */
@Slf4j
@Component
public class KubernetesOrchestratorClient implements OrchestratorClient {

    private final KubernetesClient kubernetesClient;
    private final String namespace;

    public KubernetesOrchestratorClient(KubernetesClient kubernetesClient, FleetMonitorProperties properties) {
        this.kubernetesClient = kubernetesClient;
        this.namespace = properties.getDiscovery().getNamespace();
    }

    @Override
    public List<Pod> listInstances(Map<String, String> selector) {
        try {
            List<Pod> pods = kubernetesClient.pods()
                .inNamespace(namespace)
                .withLabels(selector)
                .list()
                .getItems();
            log.debug("Listed {} pods in namespace {}", pods.size(), namespace);
            return pods;
        } catch (KubernetesClientException e) {
            throw new DiscoveryUnavailableException(
                "Failed to list pods (HTTP " + e.getCode() + "): " + e.getMessage(), namespace, e);
        }
    }

    @Override
    public List<WorkloadInfo> listWorkloads(Map<String, String> selector) {
        try {
            return kubernetesClient.apps().statefulSets()
                .inNamespace(namespace)
                .withLabels(selector)
                .list()
                .getItems()
                .stream()
                .map(KubernetesOrchestratorClient::toWorkloadInfo)
                .toList();
        } catch (KubernetesClientException e) {
            throw new DiscoveryUnavailableException(
                "Failed to list StatefulSets (HTTP " + e.getCode() + "): " + e.getMessage(), namespace, e);
        }
    }

    @Override
    public List<ServiceEndpointInfo> listServices(Map<String, String> selector) {
        try {
            return kubernetesClient.services()
                .inNamespace(namespace)
                .withLabels(selector)
                .list()
                .getItems()
                .stream()
                .map(KubernetesOrchestratorClient::toServiceInfo)
                .toList();
        } catch (KubernetesClientException e) {
            throw new DiscoveryUnavailableException(
                "Failed to list services (HTTP " + e.getCode() + "): " + e.getMessage(), namespace, e);
        }
    }

    @Override
    public Closeable watch(Map<String, String> selector, OrchestratorWatchListener listener) {
        try {
            Watch watch = kubernetesClient.pods()
                .inNamespace(namespace)
                .withLabels(selector)
                .watch(new Watcher<Pod>() {
                    @Override
                    public void eventReceived(Action action, Pod pod) {
                        String name = pod != null && pod.getMetadata() != null ? pod.getMetadata().getName() : null;
                        switch (action) {
                            case ADDED -> listener.onEvent(ChangeType.ADDED, name);
                            case MODIFIED -> listener.onEvent(ChangeType.MODIFIED, name);
                            case DELETED -> listener.onEvent(ChangeType.DELETED, name);
                            default -> log.debug("Ignoring watch event {} for {}", action, name);
                        }
                    }

                    @Override
                    public void onClose(WatcherException cause) {
                        listener.onClose(cause);
                    }

                    @Override
                    public void onClose() {
                        listener.onClose(null);
                    }
                });
            return watch::close;
        } catch (KubernetesClientException e) {
            throw new DiscoveryUnavailableException("Failed to watch pods: " + e.getMessage(), namespace, e);
        }
    }

    @Override
    public boolean deleteInstance(String resourceName) {
        try {
            List<StatusDetails> deleted = kubernetesClient.pods()
                .inNamespace(namespace)
                .withName(resourceName)
                .delete();
            return deleted != null && !deleted.isEmpty();
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                return false;
            }
            throw new DiscoveryUnavailableException(
                "Failed to delete pod " + resourceName + ": " + e.getMessage(), namespace, e);
        }
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    static WorkloadInfo toWorkloadInfo(StatefulSet statefulSet) {
        Optional<StatefulSetSpec> spec = Optional.ofNullable(statefulSet.getSpec());
        Optional<StatefulSetStatus> status = Optional.ofNullable(statefulSet.getStatus());
        return WorkloadInfo.builder()
            .name(statefulSet.getMetadata().getName())
            .serviceName(spec.map(StatefulSetSpec::getServiceName).orElse(null))
            .replicas(spec.map(StatefulSetSpec::getReplicas).orElse(0))
            .readyReplicas(status.map(StatefulSetStatus::getReadyReplicas).orElse(0))
            .currentReplicas(status.map(StatefulSetStatus::getCurrentReplicas).orElse(0))
            .generation(statefulSet.getMetadata().getGeneration())
            .observedGeneration(status.map(StatefulSetStatus::getObservedGeneration).orElse(null))
            .build();
    }

    static ServiceEndpointInfo toServiceInfo(Service service) {
        Optional<ServiceSpec> spec = Optional.ofNullable(service.getSpec());
        List<String> ports = spec.map(ServiceSpec::getPorts).orElse(List.of()).stream()
            .map(KubernetesOrchestratorClient::describePort)
            .toList();
        return ServiceEndpointInfo.builder()
            .name(service.getMetadata().getName())
            .type(spec.map(ServiceSpec::getType).orElse(null))
            .clusterIp(spec.map(ServiceSpec::getClusterIP).orElse(null))
            .ports(ports)
            .selector(spec.map(ServiceSpec::getSelector).map(Map::copyOf).orElse(Map.of()))
            .build();
    }

    private static String describePort(ServicePort port) {
        String protocol = port.getProtocol() != null ? port.getProtocol() : "TCP";
        String name = port.getName() != null ? port.getName() : "port";
        return name + ":" + port.getPort() + "/" + protocol;
    }
}
