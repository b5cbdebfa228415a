package com.locofleet.fleethealth.discovery;

import com.locofleet.fleethealth.config.FleetMonitorProperties;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes orchestrator pods into {@link FleetInstance} records.
 */
@Slf4j
@Component
public class PodInstanceMapper {

    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("-(\\d+)$");
    private static final String PHASE_RUNNING = "Running";

    private final int defaultVncPort;
    private final int defaultHealthPort;

    public PodInstanceMapper(FleetMonitorProperties properties) {
        this.defaultVncPort = properties.getDiscovery().getDefaultVncPort();
        this.defaultHealthPort = properties.getDiscovery().getDefaultHealthPort();
    }

    /**
     * @param discoveredAt first time this pod was seen
     * @return the instance, or empty when the pod is not running or has no address yet
     */
    public Optional<FleetInstance> toInstance(Pod pod, Instant discoveredAt) {
        if (pod.getMetadata() == null || pod.getStatus() == null) {
            return Optional.empty();
        }
        String phase = pod.getStatus().getPhase();
        String podIp = pod.getStatus().getPodIP();
        if (!PHASE_RUNNING.equals(phase) || podIp == null || podIp.isBlank()) {
            log.debug("Skipping pod {} (phase={}, ip={})", pod.getMetadata().getName(), phase, podIp);
            return Optional.empty();
        }

        String name = pod.getMetadata().getName();
        int ordinal = extractOrdinal(name);
        boolean ready = allContainersReady(pod);

        String hostname = pod.getSpec() != null && pod.getSpec().getHostname() != null
            ? pod.getSpec().getHostname()
            : name;

        return Optional.of(FleetInstance.builder()
            .id(FleetInstance.idForOrdinal(ordinal))
            .resourceName(name)
            .ordinal(ordinal)
            .address(podIp)
            .hostname(hostname)
            .ports(resolvePorts(pod))
            .ready(ready)
            .status(statusOf(phase, ready))
            .discoveredAt(discoveredAt)
            .lastTransition(readyTransition(pod).orElse(discoveredAt))
            .nodeName(pod.getSpec() != null ? pod.getSpec().getNodeName() : null)
            .namespace(pod.getMetadata().getNamespace())
            .build());
    }

    /**
     * Trailing {@code -<digits>} of a resource name, 0 when absent.
     */
    public static int extractOrdinal(String resourceName) {
        if (resourceName == null) {
            return 0;
        }
        Matcher matcher = ORDINAL_SUFFIX.matcher(resourceName);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            log.warn("Ordinal suffix of {} out of range, using 0", resourceName);
            return 0;
        }
    }

    static InstanceStatus statusOf(String phase, boolean ready) {
        if (phase == null) {
            return InstanceStatus.UNKNOWN;
        }
        return switch (phase) {
            case "Running" -> ready ? InstanceStatus.READY : InstanceStatus.BOOTING;
            case "Pending" -> InstanceStatus.BOOTING;
            case "Failed" -> InstanceStatus.ERROR;
            default -> InstanceStatus.UNKNOWN;
        };
    }

    private Map<String, Integer> resolvePorts(Pod pod) {
        Map<String, Integer> ports = new LinkedHashMap<>();
        if (pod.getSpec() != null && pod.getSpec().getContainers() != null) {
            for (Container container : pod.getSpec().getContainers()) {
                List<ContainerPort> declared = container.getPorts();
                if (declared == null) {
                    continue;
                }
                for (ContainerPort port : declared) {
                    if (port.getName() != null && port.getContainerPort() != null) {
                        ports.putIfAbsent(port.getName(), port.getContainerPort());
                    }
                }
            }
        }
        ports.putIfAbsent(FleetInstance.VNC_PORT, defaultVncPort);
        ports.putIfAbsent(FleetInstance.HEALTH_PORT, defaultHealthPort);
        return Map.copyOf(ports);
    }

    private static boolean allContainersReady(Pod pod) {
        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();
        return statuses != null
            && !statuses.isEmpty()
            && statuses.stream().allMatch(status -> Boolean.TRUE.equals(status.getReady()));
    }

    private static Optional<Instant> readyTransition(Pod pod) {
        List<PodCondition> conditions = pod.getStatus().getConditions();
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream()
            .filter(condition -> "Ready".equals(condition.getType()))
            .map(PodCondition::getLastTransitionTime)
            .filter(time -> time != null && !time.isBlank())
            .findFirst()
            .flatMap(PodInstanceMapper::parseTimestamp);
    }

    private static Optional<Instant> parseTimestamp(String value) {
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable transition time {}", value);
            return Optional.empty();
        }
    }
}
