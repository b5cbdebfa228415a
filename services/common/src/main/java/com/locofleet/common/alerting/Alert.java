package com.locofleet.common.alerting;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A dispatched operational alert.
 */
@Value
@Builder
public class Alert {

    public static final String SYSTEM_SUBJECT = "system";

    String id;
    Instant timestamp;
    AlertSeverity severity;
    String message;
    String instanceId;
    String service;

    @Builder.Default
    Map<String, Object> meta = Map.of();

    /**
     * Alerts sharing this key are rate limited together.
     */
    public String getCooldownKey() {
        return cooldownKey(instanceId, severity);
    }

    public static String cooldownKey(String subjectId, AlertSeverity severity) {
        return subjectId + "-" + severity.name();
    }
}
