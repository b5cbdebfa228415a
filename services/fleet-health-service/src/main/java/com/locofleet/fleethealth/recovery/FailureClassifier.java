package com.locofleet.fleethealth.recovery;

import com.locofleet.fleethealth.probe.HealthAnalysis;
import com.locofleet.fleethealth.probe.HealthAnalyzer;
import com.locofleet.fleethealth.probe.HealthIssue;
import com.locofleet.fleethealth.probe.HealthPayload;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps detected health issues to the failure category that decides the recovery strategy.
 * <ul>
 *   <li>emulator issues only: {@link FailureType#QEMU}</li>
 *   <li>network issues only: {@link FailureType#NETWORK}</li>
 *   <li>both: {@link FailureType#MIXED}</li>
 *   <li>none, but the agent reports itself unhealthy: {@link FailureType#CLIENT}</li>
 *   <li>health endpoint unreachable: {@link FailureType#MIXED}</li>
 *   <li>otherwise {@link FailureType#NONE}</li>
 * </ul>
 */
@Component
public class FailureClassifier {

    static final String UNREACHABLE_ISSUE = "health_endpoint_unreachable";
    static final String MALFORMED_ISSUE = "malformed_health_payload";

    private static final Set<String> AGENT_FAILURE_STATES = Set.of("unhealthy", "critical");

    private final HealthAnalyzer healthAnalyzer;

    public FailureClassifier(HealthAnalyzer healthAnalyzer) {
        this.healthAnalyzer = healthAnalyzer;
    }

    public FailureClassification classify(String instanceId, HealthPayload payload) {
        return classify(instanceId, payload, healthAnalyzer.analyze(payload));
    }

    public FailureClassification classify(String instanceId, HealthPayload payload, HealthAnalysis analysis) {
        List<String> issues = new ArrayList<>();
        boolean emulator = false;
        boolean network = false;
        for (HealthIssue issue : analysis.getIssues()) {
            issues.add(issue.getCode());
            if (issue.getSubsystem() == HealthIssue.Subsystem.NETWORK) {
                network = true;
            } else {
                emulator = true;
            }
        }

        FailureType type;
        if (emulator && network) {
            type = FailureType.MIXED;
        } else if (emulator) {
            type = FailureType.QEMU;
        } else if (network) {
            type = FailureType.NETWORK;
        } else if (agentReportsFailure(payload)) {
            type = FailureType.CLIENT;
            issues.add("agent_reported_" + payload.getOverallStatus().trim().toLowerCase(Locale.ROOT));
        } else {
            type = FailureType.NONE;
        }
        return FailureClassification.of(instanceId, type, issues);
    }

    /**
     * Classification for an instance whose health endpoint could not be read at all. The
     * agent may be down with the emulator, so network recovery falls through to a restart.
     */
    public FailureClassification classifyUnreachable(String instanceId) {
        return FailureClassification.of(instanceId, FailureType.MIXED, List.of(UNREACHABLE_ISSUE));
    }

    /**
     * Classification for an agent that answered with a document that could not be interpreted.
     */
    public FailureClassification classifyMalformed(String instanceId) {
        return FailureClassification.of(instanceId, FailureType.CLIENT, List.of(MALFORMED_ISSUE));
    }

    private static boolean agentReportsFailure(HealthPayload payload) {
        String status = payload.getOverallStatus();
        return status != null && AGENT_FAILURE_STATES.contains(status.trim().toLowerCase(Locale.ROOT));
    }
}
