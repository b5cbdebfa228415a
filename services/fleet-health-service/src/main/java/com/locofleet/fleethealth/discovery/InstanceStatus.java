package com.locofleet.fleethealth.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstanceStatus {
    READY,
    BOOTING,
    ERROR,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
