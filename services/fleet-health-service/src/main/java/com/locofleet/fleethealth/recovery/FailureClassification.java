package com.locofleet.fleethealth.recovery;

import lombok.Value;

import java.util.List;

@Value
public class FailureClassification {

    String instanceId;
    FailureType failureType;
    boolean recoveryNeeded;
    List<String> issues;

    public static FailureClassification of(String instanceId, FailureType failureType, List<String> issues) {
        return new FailureClassification(instanceId, failureType, failureType != FailureType.NONE, List.copyOf(issues));
    }

    public static FailureClassification healthy(String instanceId) {
        return of(instanceId, FailureType.NONE, List.of());
    }
}
