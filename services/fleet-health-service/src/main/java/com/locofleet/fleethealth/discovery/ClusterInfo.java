package com.locofleet.fleethealth.discovery;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Cluster-side diagnostics of the fleet: controller replica counts and exposed services.
 */
@Value
@Builder
public class ClusterInfo {
    boolean available;
    List<WorkloadInfo> statefulSets;
    List<ServiceEndpointInfo> services;
    Instant fetchedAt;
    String error;

    public static ClusterInfo unavailable(String error, Instant at) {
        return ClusterInfo.builder()
            .available(false)
            .statefulSets(List.of())
            .services(List.of())
            .fetchedAt(at)
            .error(error)
            .build();
    }

    public int getReadyReplicas() {
        return statefulSets.stream().mapToInt(WorkloadInfo::getReadyReplicas).sum();
    }

    public int getDesiredReplicas() {
        return statefulSets.stream().mapToInt(WorkloadInfo::getReplicas).sum();
    }
}
