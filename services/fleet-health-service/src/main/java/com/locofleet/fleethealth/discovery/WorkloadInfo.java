package com.locofleet.fleethealth.discovery;

import lombok.Builder;
import lombok.Value;

/**
 * Replica state of one fleet StatefulSet.
 */
@Value
@Builder
public class WorkloadInfo {
    String name;
    String serviceName;
    int replicas;
    int readyReplicas;
    int currentReplicas;
    Long generation;
    Long observedGeneration;

    public boolean isFullyReady() {
        return readyReplicas >= replicas;
    }
}
