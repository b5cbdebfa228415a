package com.locofleet.common.alerting;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Alert sink configuration.
 *
 * <pre>
 * fleet:
 *   alerting:
 *     cooldown: 5m
 *     webhook:
 *       url: ${ALERT_WEBHOOK_URL:}
 *       timeout: 5s
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "fleet.alerting")
@Data
@Validated
public class AlertingProperties {

    /**
     * Enable/disable alert dispatch globally. Suppressed alerts are still logged.
     */
    @NotNull
    private Boolean enabled = true;

    /**
     * Alerts with the same (subject, severity) inside this window are dropped.
     */
    @NotNull
    private Duration cooldown = Duration.ofMinutes(5);

    /**
     * Service name stamped on every alert.
     */
    @NotBlank
    private String serviceName = "lego-loco-cluster";

    private WebhookConfig webhook = new WebhookConfig();

    @Data
    public static class WebhookConfig {
        private String url;
        private Duration timeout = Duration.ofSeconds(5);
    }
}
