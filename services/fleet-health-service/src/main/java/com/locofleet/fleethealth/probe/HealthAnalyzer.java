package com.locofleet.fleethealth.probe;

import com.locofleet.fleethealth.config.FleetMonitorProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a health payload: 100 minus the penalty of every detected {@link HealthIssue},
 * clamped to [0, 100]. Issues are collected into an {@link EnumSet}, so the result does not
 * depend on detection order.
 */
@Component
public class HealthAnalyzer {

    private final FleetMonitorProperties.Thresholds thresholds;

    public HealthAnalyzer(FleetMonitorProperties properties) {
        this.thresholds = properties.getHealth().getThresholds();
    }

    public HealthAnalysis analyze(HealthPayload payload) {
        Set<HealthIssue> issues = detectIssues(payload);

        int score = 100;
        for (HealthIssue issue : issues) {
            score -= issue.getPenalty();
        }
        score = Math.max(0, Math.min(100, score));

        List<String> recommendations = issues.stream()
            .map(HealthIssue::getRecommendation)
            .toList();

        return new HealthAnalysis(score, Collections.unmodifiableSet(issues), recommendations,
            SlaStatus.fromScore(score));
    }

    Set<HealthIssue> detectIssues(HealthPayload payload) {
        Set<HealthIssue> issues = EnumSet.noneOf(HealthIssue.class);

        // Not reporting the emulator process counts as down
        if (!Boolean.TRUE.equals(payload.getQemuHealthy())) {
            issues.add(HealthIssue.QEMU_NOT_RUNNING);
        }

        payload.performance().ifPresent(performance -> {
            if (exceeds(performance.cpuUsage(), thresholds.getCpuUsage())) {
                issues.add(HealthIssue.HIGH_CPU_USAGE);
            }
            if (exceeds(performance.memoryUsage(), thresholds.getMemoryUsage())) {
                issues.add(HealthIssue.HIGH_MEMORY_USAGE);
            }
        });

        payload.video().ifPresent(video -> {
            if (!Boolean.TRUE.equals(video.vncAvailable())) {
                issues.add(HealthIssue.VNC_UNAVAILABLE);
            }
            Double frameRate = video.estimatedFrameRate();
            if (frameRate != null && frameRate > 0 && frameRate < thresholds.getFrameRate()) {
                issues.add(HealthIssue.LOW_FRAME_RATE);
            }
        });

        payload.audio().ifPresent(audio -> {
            if (!Boolean.TRUE.equals(audio.pulseRunning())) {
                issues.add(HealthIssue.AUDIO_SYSTEM_DOWN);
            }
        });

        payload.network().ifPresent(network -> {
            if (!Boolean.TRUE.equals(network.bridgeUp()) || !Boolean.TRUE.equals(network.tapUp())) {
                issues.add(HealthIssue.NETWORK_INTERFACE_DOWN);
            }
            if (exceeds(network.txErrorRate(), thresholds.getTxErrorRate())) {
                issues.add(HealthIssue.HIGH_NETWORK_ERRORS);
            }
        });

        return issues;
    }

    private static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }
}
