package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProbeStatus {
    OK,
    FAILED,
    TIMEOUT,
    PROTOCOL_ERROR,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
