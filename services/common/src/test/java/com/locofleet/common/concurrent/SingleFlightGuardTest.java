package com.locofleet.common.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SingleFlightGuard")
class SingleFlightGuardTest {

    private final SingleFlightGuard guard = new SingleFlightGuard("deep-health");

    @Test
    @DisplayName("skips a trigger while the previous run is still in flight")
    void shouldSkipOverlappingRun() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        try {
            Optional<CompletableFuture<Void>> first = guard.trySubmit(executor, () -> {
                runs.incrementAndGet();
                await(release);
            });
            Optional<CompletableFuture<Void>> second = guard.trySubmit(executor, runs::incrementAndGet);

            assertThat(first).isPresent();
            assertThat(second).isEmpty();
            assertThat(guard.getSkippedCount()).isEqualTo(1);

            release.countDown();
            first.get().get(5, TimeUnit.SECONDS);

            assertThat(guard.isRunning()).isFalse();
            assertThat(guard.trySubmit(executor, runs::incrementAndGet)).isPresent();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("releases the guard after a failed run")
    void shouldReleaseAfterFailure() {
        Optional<CompletableFuture<Void>> failed = guard.trySubmit(Runnable::run, () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(failed).isPresent();
        assertThat(failed.get()).isCompletedExceptionally();
        assertThat(guard.isRunning()).isFalse();
        assertThat(guard.trySubmit(Runnable::run, () -> { })).isPresent();
    }

    @Test
    @DisplayName("rejects a nested run from inside the running task")
    void shouldSkipReentrantRun() {
        AtomicInteger inner = new AtomicInteger();

        guard.trySubmit(Runnable::run,
            () -> assertThat(guard.trySubmit(Runnable::run, inner::incrementAndGet)).isEmpty());

        assertThat(inner).hasValue(0);
        assertThat(guard.getSkippedCount()).isEqualTo(1);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
