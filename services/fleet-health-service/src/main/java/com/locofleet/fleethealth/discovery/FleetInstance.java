package com.locofleet.fleethealth.discovery;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One emulator instance as seen by a single discovery cycle. Superseded, never mutated,
 * by the next cycle's record with the same id.
 */
@Value
@Builder(toBuilder = true)
public class FleetInstance {

    public static final String VNC_PORT = "vnc";
    public static final String HEALTH_PORT = "health";

    String id;
    String resourceName;
    int ordinal;
    String address;
    String hostname;
    Map<String, Integer> ports;
    boolean ready;
    InstanceStatus status;
    Instant discoveredAt;
    Instant lastTransition;
    String nodeName;
    String namespace;

    public int getVncPort() {
        return ports.get(VNC_PORT);
    }

    public int getHealthPort() {
        return ports.get(HEALTH_PORT);
    }

    /**
     * Base URL of the in-instance health agent, e.g. {@code http://10.0.0.5:8080}.
     */
    public String agentBaseUrl() {
        return "http://" + address + ":" + getHealthPort();
    }

    public static String idForOrdinal(int ordinal) {
        return "instance-" + ordinal;
    }
}
