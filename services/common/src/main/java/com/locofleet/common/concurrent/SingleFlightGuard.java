package com.locofleet.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admits at most one run of a task at a time. A trigger that arrives while the previous run
 * is still in progress is skipped, not queued.
 */
@Slf4j
public class SingleFlightGuard {

    private final String name;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong skipped = new AtomicLong();

    public SingleFlightGuard(String name) {
        this.name = name;
    }

    /**
     * Runs {@code task} on {@code executor} unless a run is already in flight.
     *
     * @return the run's completion, or empty when skipped
     */
    public Optional<CompletableFuture<Void>> trySubmit(Executor executor, Runnable task) {
        if (!running.compareAndSet(false, true)) {
            skipped.incrementAndGet();
            log.warn("Skipping {} cycle: previous cycle still running", name);
            return Optional.empty();
        }
        try {
            return Optional.of(CompletableFuture.runAsync(task, executor)
                .whenComplete((ignored, error) -> {
                    running.set(false);
                    if (error != null) {
                        log.error("{} cycle failed", name, error);
                    }
                }));
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.warn("{} cycle rejected by executor: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getSkippedCount() {
        return skipped.get();
    }

    public String getName() {
        return name;
    }
}
