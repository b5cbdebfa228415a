package com.locofleet.fleethealth.probe;

import com.locofleet.common.exception.HealthProbeException;
import com.locofleet.common.exception.RecoveryActionException;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.FleetInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the health agent running inside each instance.
 */
@Slf4j
@Component
public class InstanceAgentClient {

    private final RestTemplate restTemplate;
    private final HealthPayloadParser payloadParser;
    private final String healthPath;
    private final String networkRecoveryPath;

    public InstanceAgentClient(@Qualifier("agentRestTemplate") RestTemplate restTemplate,
                               HealthPayloadParser payloadParser,
                               FleetMonitorProperties properties) {
        this.restTemplate = restTemplate;
        this.payloadParser = payloadParser;
        this.healthPath = properties.getHealth().getPath();
        this.networkRecoveryPath = properties.getRecovery().getNetworkRecoveryPath();
    }

    /**
     * Reads and parses the agent's health document.
     *
     * @throws HealthProbeException on transport failure or non-2xx status
     * @throws com.locofleet.common.exception.MalformedHealthPayloadException when the body cannot be interpreted
     */
    public HealthPayload fetchHealth(FleetInstance instance) {
        String url = instance.agentBaseUrl() + healthPath;
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);
        } catch (HttpStatusCodeException e) {
            throw new HealthProbeException("Health endpoint returned HTTP " + e.getStatusCode().value(),
                instance.getId(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new HealthProbeException("Health request to " + url + " failed: " + e.getMessage(),
                instance.getId(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new HealthProbeException("Health endpoint returned HTTP " + response.getStatusCode().value(),
                instance.getId(), response.getStatusCode().value());
        }
        return payloadParser.parse(response.getBody());
    }

    /**
     * Asks the agent to reset the instance's bridge and TAP interfaces. Safe to repeat.
     */
    public void requestNetworkRecovery(FleetInstance instance) {
        String url = instance.agentBaseUrl() + networkRecoveryPath;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, null, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new RecoveryActionException("Network recovery returned HTTP " + response.getStatusCode().value(),
                    instance.getId(), "network");
            }
            log.info("Network recovery requested for {} via {}", instance.getId(), url);
        } catch (RestClientException e) {
            throw new RecoveryActionException("Network recovery request failed: " + e.getMessage(),
                instance.getId(), "network", e);
        }
    }
}
