package com.locofleet.fleethealth.probe;

import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
public class HealthAnalysis {

    int score;
    /** Triggered issues in declaration order of {@link HealthIssue}. */
    Set<HealthIssue> issues;
    List<String> recommendations;
    SlaStatus slaStatus;

    public boolean hasIssue(HealthIssue issue) {
        return issues.contains(issue);
    }
}
