package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlaStatus {
    COMPLIANT,
    WARNING,
    DEGRADED,
    CRITICAL;

    /**
     * {@code <50} critical, {@code <80} degraded, {@code <95} warning, otherwise compliant.
     */
    public static SlaStatus fromScore(int score) {
        if (score < 50) {
            return CRITICAL;
        }
        if (score < 80) {
            return DEGRADED;
        }
        if (score < 95) {
            return WARNING;
        }
        return COMPLIANT;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
