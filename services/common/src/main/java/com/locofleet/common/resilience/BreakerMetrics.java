package com.locofleet.common.resilience;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for one breaker. Thread-safe; read by status endpoints while calls are in flight.
 */
public class BreakerMetrics {

    private final String name;
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong opens = new AtomicLong();
    private final AtomicLong halfOpens = new AtomicLong();
    private final AtomicLong closes = new AtomicLong();

    private volatile BreakerState state = BreakerState.CLOSED;
    private volatile Instant lastStateChange;
    private volatile Instant openedAt;

    BreakerMetrics(String name, Instant createdAt) {
        this.name = name;
        this.lastStateChange = createdAt;
    }

    void recordSuccess() {
        successes.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    void recordTimeout() {
        timeouts.incrementAndGet();
    }

    void recordFallback() {
        fallbacks.incrementAndGet();
    }

    void recordRejection() {
        rejections.incrementAndGet();
    }

    void recordTransition(BreakerState to, Instant at) {
        switch (to) {
            case OPEN -> {
                opens.incrementAndGet();
                openedAt = at;
            }
            case HALF_OPEN -> halfOpens.incrementAndGet();
            case CLOSED -> {
                closes.incrementAndGet();
                openedAt = null;
            }
        }
        state = to;
        lastStateChange = at;
    }

    public String getName() {
        return name;
    }

    public BreakerState getState() {
        return state;
    }

    public long getSuccesses() {
        return successes.get();
    }

    /**
     * Failed calls, timeouts excluded.
     */
    public long getFailures() {
        return failures.get();
    }

    public long getTimeouts() {
        return timeouts.get();
    }

    public long getFallbacks() {
        return fallbacks.get();
    }

    public long getRejections() {
        return rejections.get();
    }

    public long getOpens() {
        return opens.get();
    }

    public long getHalfOpens() {
        return halfOpens.get();
    }

    public long getCloses() {
        return closes.get();
    }

    public Instant getLastStateChange() {
        return lastStateChange;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public long getTotalRequests() {
        return getSuccesses() + getFailures() + getTimeouts();
    }

    public long getTotalFailures() {
        return getFailures() + getTimeouts();
    }

    public double getErrorRate() {
        long total = getTotalRequests();
        return total > 0 ? (getTotalFailures() * 100.0) / total : 0.0;
    }
}
