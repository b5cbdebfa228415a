package com.locofleet.fleethealth.probe;

import com.locofleet.fleethealth.discovery.SnapshotSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one deep health cycle.
 */
@Value
@Builder
public class HealthCheckCycle {

    Instant startedAt;
    Instant completedAt;
    SnapshotSource snapshotSource;
    List<HealthResult> results;
    int healthy;
    int unhealthy;
    int errors;
    int breakerOpen;
    /** Set when the cycle itself failed. */
    String failure;

    public static HealthCheckCycle of(Instant startedAt, Instant completedAt, SnapshotSource source,
                                      List<HealthResult> results) {
        return HealthCheckCycle.builder()
            .startedAt(startedAt)
            .completedAt(completedAt)
            .snapshotSource(source)
            .results(List.copyOf(results))
            .healthy(count(results, HealthStatus.HEALTHY))
            .unhealthy(count(results, HealthStatus.UNHEALTHY))
            .errors(count(results, HealthStatus.ERROR))
            .breakerOpen(count(results, HealthStatus.CIRCUIT_BREAKER_OPEN))
            .build();
    }

    public static HealthCheckCycle failed(Instant startedAt, Instant completedAt, String failure) {
        return HealthCheckCycle.builder()
            .startedAt(startedAt)
            .completedAt(completedAt)
            .results(List.of())
            .failure(failure)
            .build();
    }

    public int getTotal() {
        return results.size();
    }

    private static int count(List<HealthResult> results, HealthStatus status) {
        return (int) results.stream().filter(result -> result.getStatus() == status).count();
    }
}
