package com.locofleet.fleethealth.config;

import com.locofleet.common.resilience.WindowType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fleet monitoring configuration, bound from {@code fleet.*}.
 * <p>
 * Invalid values fail application startup.
 */
@Configuration
@ConfigurationProperties(prefix = "fleet")
@Data
@Validated
public class FleetMonitorProperties {

    @Valid
    private Discovery discovery = new Discovery();

    @Valid
    private Health health = new Health();

    @Valid
    private Connectivity connectivity = new Connectivity();

    @Valid
    private Recovery recovery = new Recovery();

    @Data
    public static class Discovery {

        @NotBlank
        private String namespace = "loco";

        /**
         * Comma separated {@code key=value} label selector.
         */
        @NotBlank
        private String labelSelector = "app.kubernetes.io/component=emulator,app.kubernetes.io/part-of=lego-loco-cluster";

        /**
         * Selector for the controllers and services reported as cluster diagnostics.
         */
        @NotBlank
        private String clusterLabelSelector = "app.kubernetes.io/part-of=lego-loco-cluster";

        @NotNull
        private Duration cacheTtl = Duration.ofSeconds(30);

        @NotNull
        private Duration refreshInterval = Duration.ofSeconds(30);

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(10);

        private boolean refreshEnabled = true;

        private boolean watchEnabled = true;

        @Min(1)
        @Max(65535)
        private int defaultVncPort = 5901;

        @Min(1)
        @Max(65535)
        private int defaultHealthPort = 8080;

        /**
         * Parsed form of {@link #labelSelector}, in declaration order.
         */
        public Map<String, String> selectorLabels() {
            return parseSelector(labelSelector);
        }

        public Map<String, String> clusterSelectorLabels() {
            return parseSelector(clusterLabelSelector);
        }

        private static Map<String, String> parseSelector(String selector) {
            Map<String, String> labels = new LinkedHashMap<>();
            for (String term : selector.split(",")) {
                String trimmed = term.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Invalid label selector term: " + trimmed);
                }
                labels.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
            }
            return labels;
        }
    }

    @Data
    public static class Health {

        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofSeconds(30);

        @NotBlank
        private String path = "/health";

        /**
         * Connect and read timeout of one health request.
         */
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound for one probe including its retries.
         */
        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(20);

        @NotNull
        private Duration cycleTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int maxConcurrentProbes = 16;

        @Min(1)
        private int historySize = 100;

        @Valid
        private Retry retry = new Retry();

        @Valid
        private BreakerConfig breaker = new BreakerConfig();

        @Valid
        private Thresholds thresholds = new Thresholds();

        /**
         * A time-based probe window must be able to hold {@code minimumNumberOfCalls} probes
         * at the configured interval, otherwise the breakers can never open.
         */
        @AssertTrue(message = "fleet.health.breaker.rolling-window must span minimum-number-of-calls health intervals "
            + "when window-type is TIME_BASED")
        public boolean isBreakerWindowReachable() {
            if (breaker == null || interval == null || breaker.getRollingWindow() == null
                || breaker.getWindowType() != WindowType.TIME_BASED) {
                return true;
            }
            Duration needed = interval.multipliedBy(breaker.getMinimumNumberOfCalls());
            return breaker.getRollingWindow().compareTo(needed) >= 0;
        }
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Data
    public static class BreakerConfig {

        @DecimalMin("1")
        @DecimalMax("100")
        private float errorThresholdPercentage = 50f;

        @Min(1)
        private int minimumNumberOfCalls = 5;

        @NotNull
        private Duration resetTimeout = Duration.ofSeconds(60);

        @NotNull
        private Duration rollingWindow = Duration.ofSeconds(60);

        @NotNull
        private WindowType windowType = WindowType.COUNT_BASED;
    }

    @Data
    public static class Thresholds {

        private double cpuUsage = 80;

        private double memoryUsage = 85;

        private double frameRate = 10;

        private double txErrorRate = 5;

        @NotNull
        private Duration responseTime = Duration.ofSeconds(5);
    }

    @Data
    public static class Connectivity {

        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofSeconds(5);

        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Recovery {

        private boolean enabled = true;

        @Min(1)
        private int maxAttempts = 3;

        @NotBlank
        private String networkRecoveryPath = "/recovery/network";
    }
}
