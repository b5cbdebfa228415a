package com.locofleet.fleethealth.discovery;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ServiceEndpointInfo {
    String name;
    String type;
    String clusterIp;
    /**
     * {@code name:port/protocol} per exposed port.
     */
    List<String> ports;
    Map<String, String> selector;
}
