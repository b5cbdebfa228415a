package com.locofleet.fleethealth.probe;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Health document reported by the agent inside an instance.
 * <p>
 * Each section is optional: an absent section means the agent did not report on that
 * subsystem, which is different from a present section with failing fields. Within a
 * present section a {@code null} field means "not reported".
 */
@Value
@Builder(toBuilder = true)
public class HealthPayload {

    /** {@code qemu_healthy}; null when not reported. */
    Boolean qemuHealthy;

    /** {@code overall_status} as self-assessed by the agent. */
    String overallStatus;

    @Getter(AccessLevel.NONE)
    Video video;

    @Getter(AccessLevel.NONE)
    Audio audio;

    @Getter(AccessLevel.NONE)
    Performance performance;

    @Getter(AccessLevel.NONE)
    Network network;

    @Builder.Default
    List<String> reportedIssues = List.of();

    public Optional<Video> video() {
        return Optional.ofNullable(video);
    }

    public Optional<Audio> audio() {
        return Optional.ofNullable(audio);
    }

    public Optional<Performance> performance() {
        return Optional.ofNullable(performance);
    }

    public Optional<Network> network() {
        return Optional.ofNullable(network);
    }

    public record Video(Boolean vncAvailable, Double estimatedFrameRate) {
    }

    public record Audio(Boolean pulseRunning) {
    }

    public record Performance(Double cpuUsage, Double memoryUsage) {
    }

    public record Network(Boolean bridgeUp, Boolean tapUp, Double txErrorRate) {
    }
}
