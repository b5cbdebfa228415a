package com.locofleet.fleethealth.recovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecoveryAttemptTracker")
class RecoveryAttemptTrackerTest {

    private static final Instant AT = Instant.parse("2025-06-01T12:00:00Z");

    private final RecoveryAttemptTracker tracker = new RecoveryAttemptTracker(3);

    @Test
    @DisplayName("hands out attempts 1..max and then refuses")
    void shouldCapAttempts() {
        assertThat(tracker.tryBeginAttempt("instance-0", FailureType.QEMU, AT)).hasValue(1);
        assertThat(tracker.tryBeginAttempt("instance-0", FailureType.QEMU, AT)).hasValue(2);
        assertThat(tracker.tryBeginAttempt("instance-0", FailureType.QEMU, AT)).hasValue(3);

        OptionalInt fourth = tracker.tryBeginAttempt("instance-0", FailureType.NETWORK, AT);

        assertThat(fourth).isEmpty();
        assertThat(tracker.getAttempts("instance-0")).isEqualTo(3);
        RecoveryRecord record = tracker.get("instance-0").orElseThrow();
        assertThat(record.getState()).isEqualTo(RecoveryState.RECOVERY_EXHAUSTED);
        assertThat(record.getLastFailureType()).isEqualTo(FailureType.NETWORK);
    }

    @Test
    @DisplayName("resets the counter and reports the previous count")
    void shouldReset() {
        tracker.tryBeginAttempt("instance-1", FailureType.QEMU, AT);
        tracker.tryBeginAttempt("instance-1", FailureType.QEMU, AT);

        int previous = tracker.reset("instance-1", AT);

        assertThat(previous).isEqualTo(2);
        assertThat(tracker.getAttempts("instance-1")).isZero();
        assertThat(tracker.get("instance-1").orElseThrow().getState()).isEqualTo(RecoveryState.HEALTHY);
    }

    @Test
    @DisplayName("records a failure without consuming an attempt")
    void shouldRecordFailureOnly() {
        tracker.recordFailure("instance-2", FailureType.NETWORK, AT);

        assertThat(tracker.getAttempts("instance-2")).isZero();
        assertThat(tracker.get("instance-2").orElseThrow().getLastFailureType()).isEqualTo(FailureType.NETWORK);
    }

    @Test
    @DisplayName("never exceeds the cap under concurrent claims")
    void shouldCapConcurrentClaims() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        for (int i = 0; i < 32; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (tracker.tryBeginAttempt("instance-3", FailureType.QEMU, AT).isPresent()) {
                    granted.incrementAndGet();
                }
            });
        }

        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(granted).hasValue(3);
        assertThat(tracker.getAttempts("instance-3")).isEqualTo(3);
    }
}
