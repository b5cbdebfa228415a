package com.locofleet.common.resilience;

import com.locofleet.common.exception.FleetException;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry loop with exponential backoff.
 * <p>
 * Attempt {@code n} (1-based) that fails waits {@code baseDelay * multiplier^(n-1)} before
 * attempt {@code n + 1}. The last failure is rethrown unchanged once attempts are exhausted.
 */
@Slf4j
public final class BackoffRetry {

    private final int maxAttempts;
    private final IntervalFunction intervalFunction;
    private final Sleeper sleeper;

    private BackoffRetry(int maxAttempts, IntervalFunction intervalFunction, Sleeper sleeper) {
        this.maxAttempts = maxAttempts;
        this.intervalFunction = intervalFunction;
        this.sleeper = sleeper;
    }

    public static BackoffRetry exponential(int maxAttempts, Duration baseDelay, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return new BackoffRetry(maxAttempts,
            IntervalFunction.ofExponentialBackoff(baseDelay, multiplier), sleeper);
    }

    public <T> T execute(String operationName, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = Duration.ofMillis(intervalFunction.apply(attempt));
                log.warn("Retry attempt {}/{} of {} failed, retrying in {}ms: {}",
                    attempt, maxAttempts, operationName, delay.toMillis(), e.getMessage());
                pause(operationName, delay, e);
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay that follows a failed attempt.
     */
    public Duration delayAfterAttempt(int attempt) {
        return Duration.ofMillis(intervalFunction.apply(attempt));
    }

    private void pause(String operationName, Duration delay, RuntimeException lastFailure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            FleetException interrupted = new FleetException("Retry of " + operationName + " interrupted", ie);
            interrupted.addSuppressed(lastFailure);
            throw interrupted;
        }
    }
}
