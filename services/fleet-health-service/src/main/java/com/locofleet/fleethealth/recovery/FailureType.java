package com.locofleet.fleethealth.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FailureType {
    NONE,
    NETWORK,
    /** Emulator subsystem: process, display, audio or resource pressure. */
    QEMU,
    /** Fault the backend cannot act on. */
    CLIENT,
    MIXED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
