package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issues detected in a health payload, with their score penalty.
 */
public enum HealthIssue {

    QEMU_NOT_RUNNING(30, Subsystem.EMULATOR, "Restart the QEMU emulator process"),
    HIGH_CPU_USAGE(15, Subsystem.EMULATOR, "Check guest workload or raise the CPU limit"),
    HIGH_MEMORY_USAGE(15, Subsystem.EMULATOR, "Check for memory leaks or restart the instance"),
    VNC_UNAVAILABLE(20, Subsystem.EMULATOR, "Restart the VNC server or check the display configuration"),
    LOW_FRAME_RATE(10, Subsystem.EMULATOR, "Check video performance of the emulator"),
    AUDIO_SYSTEM_DOWN(15, Subsystem.EMULATOR, "Restart PulseAudio"),
    NETWORK_INTERFACE_DOWN(10, Subsystem.NETWORK, "Check the bridge and TAP interface configuration"),
    HIGH_NETWORK_ERRORS(5, Subsystem.NETWORK, "Investigate transmit errors and packet loss");

    public enum Subsystem {
        EMULATOR,
        NETWORK
    }

    private final int penalty;
    private final Subsystem subsystem;
    private final String recommendation;

    HealthIssue(int penalty, Subsystem subsystem, String recommendation) {
        this.penalty = penalty;
        this.subsystem = subsystem;
        this.recommendation = recommendation;
    }

    public int getPenalty() {
        return penalty;
    }

    public Subsystem getSubsystem() {
        return subsystem;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
