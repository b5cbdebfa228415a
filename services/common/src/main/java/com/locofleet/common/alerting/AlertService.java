package com.locofleet.common.alerting;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for operational alerts.
 * <p>
 * Alerts are rate limited per (subject, severity) and fanned out to every enabled
 * {@link AlertChannel}. Sending an alert never throws: channel failures are logged and counted.
 *
 * @author Loco Fleet Operations
 */
@Slf4j
@Service
public class AlertService {

    private final AlertingProperties properties;
    private final List<AlertChannel> channels;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AlertCooldownTracker cooldownTracker;

    public AlertService(AlertingProperties properties,
                        List<AlertChannel> channels,
                        ApplicationEventPublisher eventPublisher,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.properties = properties;
        this.channels = List.copyOf(channels);
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.cooldownTracker = new AlertCooldownTracker(clock);
    }

    public Optional<Alert> sendAlert(AlertSeverity severity, String message) {
        return sendAlert(severity, message, Alert.SYSTEM_SUBJECT, Map.of());
    }

    public Optional<Alert> sendAlert(AlertSeverity severity, String message, String instanceId) {
        return sendAlert(severity, message, instanceId, Map.of());
    }

    /**
     * Builds and dispatches an alert unless the same subject raised the same severity
     * within the cooldown window.
     *
     * @return the dispatched alert, or empty when suppressed
     */
    public Optional<Alert> sendAlert(AlertSeverity severity,
                                     String message,
                                     String instanceId,
                                     Map<String, Object> meta) {
        String subject = instanceId != null ? instanceId : Alert.SYSTEM_SUBJECT;

        if (!Boolean.TRUE.equals(properties.getEnabled())) {
            log.info("Alerting disabled, dropping {} alert for {}: {}", severity, subject, message);
            return Optional.empty();
        }

        if (!cooldownTracker.tryAcquire(Alert.cooldownKey(subject, severity), properties.getCooldown())) {
            meterRegistry.counter("fleet.alerts.suppressed", "severity", severity.name()).increment();
            return Optional.empty();
        }

        Alert alert = Alert.builder()
            .id("alert-" + UUID.randomUUID())
            .timestamp(clock.instant())
            .severity(severity)
            .message(message)
            .instanceId(subject)
            .service(properties.getServiceName())
            .meta(meta != null ? Map.copyOf(meta) : Map.of())
            .build();

        logAlert(alert);
        dispatch(alert);
        meterRegistry.counter("fleet.alerts.raised", "severity", severity.name()).increment();

        try {
            eventPublisher.publishEvent(new AlertRaisedEvent(this, alert));
        } catch (RuntimeException e) {
            log.error("Failed to publish alert event {}", alert.getId(), e);
        }
        return Optional.of(alert);
    }

    public void clearCooldown(String instanceId, AlertSeverity severity) {
        cooldownTracker.clear(Alert.cooldownKey(instanceId, severity));
    }

    public void clearAllCooldowns() {
        cooldownTracker.clearAll();
    }

    private void dispatch(Alert alert) {
        for (AlertChannel channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }
            try {
                channel.dispatch(alert);
                meterRegistry.counter("fleet.alerts.delivered", "channel", channel.getName()).increment();
            } catch (RuntimeException e) {
                meterRegistry.counter("fleet.alerts.delivery.failed", "channel", channel.getName()).increment();
                log.error("Failed to deliver alert {} via {}: {}", alert.getId(), channel.getName(), e.getMessage());
            }
        }
    }

    private void logAlert(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL, ERROR -> log.error("ALERT [{}] {}: {}", alert.getSeverity(), alert.getInstanceId(), alert.getMessage());
            case WARNING -> log.warn("ALERT [{}] {}: {}", alert.getSeverity(), alert.getInstanceId(), alert.getMessage());
            default -> log.info("ALERT [{}] {}: {}", alert.getSeverity(), alert.getInstanceId(), alert.getMessage());
        }
    }
}
