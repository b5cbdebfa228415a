package com.locofleet.fleethealth.recovery;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-instance recovery attempt counters, capped at {@code maxAttempts}. All updates are
 * atomic per instance.
 */
public class RecoveryAttemptTracker {

    private final int maxAttempts;
    private final Map<String, RecoveryRecord> records = new ConcurrentHashMap<>();

    public RecoveryAttemptTracker(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    /**
     * Claims the next attempt for the instance.
     *
     * @return the 1-based attempt number, or empty when attempts are exhausted
     */
    public OptionalInt tryBeginAttempt(String instanceId, FailureType failureType, Instant at) {
        int[] claimed = {0};
        records.compute(instanceId, (id, current) -> {
            RecoveryRecord record = current != null ? current : RecoveryRecord.builder().build();
            if (record.getAttempts() >= maxAttempts) {
                return record.toBuilder()
                    .state(RecoveryState.RECOVERY_EXHAUSTED)
                    .lastFailureType(failureType)
                    .updatedAt(at)
                    .build();
            }
            claimed[0] = record.getAttempts() + 1;
            return record.toBuilder()
                .attempts(claimed[0])
                .state(RecoveryState.RECOVERY_PENDING)
                .lastFailureType(failureType)
                .updatedAt(at)
                .build();
        });
        return claimed[0] > 0 ? OptionalInt.of(claimed[0]) : OptionalInt.empty();
    }

    /**
     * Records a failure without claiming an attempt.
     */
    public void recordFailure(String instanceId, FailureType failureType, Instant at) {
        records.compute(instanceId, (id, current) -> (current != null ? current : RecoveryRecord.builder().build())
            .toBuilder()
            .lastFailureType(failureType)
            .updatedAt(at)
            .build());
    }

    public void markExhausted(String instanceId, Instant at) {
        records.computeIfPresent(instanceId, (id, current) -> current.toBuilder()
            .state(RecoveryState.RECOVERY_EXHAUSTED)
            .updatedAt(at)
            .build());
    }

    /**
     * Resets the counter to zero and the state to {@link RecoveryState#HEALTHY}.
     *
     * @return attempts recorded before the reset
     */
    public int reset(String instanceId, Instant at) {
        RecoveryRecord previous = records.put(instanceId, RecoveryRecord.builder().updatedAt(at).build());
        return previous != null ? previous.getAttempts() : 0;
    }

    public Optional<RecoveryRecord> get(String instanceId) {
        return Optional.ofNullable(records.get(instanceId));
    }

    public int getAttempts(String instanceId) {
        return get(instanceId).map(RecoveryRecord::getAttempts).orElse(0);
    }

    public Map<String, RecoveryRecord> all() {
        return new TreeMap<>(records);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
