package com.locofleet.common.resilience;

import com.locofleet.common.exception.BreakerOpenException;
import com.locofleet.common.exception.GatewayCallException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * A named, circuit-protected operation.
 * <p>
 * {@link #fire(Object)} runs the wrapped operation under a time limit; a call that exceeds it
 * is abandoned and its worker thread interrupted. While the breaker is
 * open the operation is not invoked and the fallback (if any) is returned instead. Failures
 * and timeouts feed the rolling window; when a fallback exists it is also used for them so
 * callers degrade instead of failing.
 *
 * @param <T> operation input
 * @param <R> operation result
 */
@Slf4j
public final class Breaker<T, R> {

    private final String name;
    private final Function<T, R> operation;
    private final Function<T, R> fallback;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final BreakerMetrics metrics;
    private final MeterRegistry meterRegistry;

    Breaker(String name,
            Function<T, R> operation,
            Function<T, R> fallback,
            CircuitBreaker circuitBreaker,
            TimeLimiter timeLimiter,
            ExecutorService executor,
            BreakerMetrics metrics,
            MeterRegistry meterRegistry) {
        this.name = name;
        this.operation = operation;
        this.fallback = fallback;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
        this.metrics = metrics;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Executes the operation if the breaker admits the call.
     *
     * @throws BreakerOpenException  when open and no fallback is configured
     * @throws GatewayCallException  when the call fails or times out and no fallback is configured
     */
    public R fire(T input) {
        if (!circuitBreaker.tryAcquirePermission()) {
            metrics.recordRejection();
            count("rejected");
            log.debug("Breaker {} is open, short-circuiting call", name);
            return fallbackOrThrow(input, new BreakerOpenException(name));
        }

        long start = System.nanoTime();
        try {
            // cancel(true) on timeout interrupts the worker
            R result = timeLimiter.executeFutureSupplier(() -> executor.submit(() -> operation.apply(input)));
            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            metrics.recordSuccess();
            count("success");
            return result;
        } catch (TimeoutException e) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            metrics.recordTimeout();
            count("timeout");
            log.warn("Call through breaker {} timed out after {}",
                name, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return fallbackOrThrow(input, new GatewayCallException(name, true, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releasePermission();
            throw new GatewayCallException(name, e);
        } catch (Exception e) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            metrics.recordFailure();
            count("failure");
            log.warn("Call through breaker {} failed: {}", name, e.getMessage());
            return fallbackOrThrow(input, new GatewayCallException(name, e));
        }
    }

    /**
     * Whether calls are currently short-circuited. An open breaker whose reset timeout has
     * elapsed moves to half-open here, so the next {@link #fire(Object)} is the trial call.
     */
    public boolean isOpen() {
        if (circuitBreaker.getState() != CircuitBreaker.State.OPEN
            && circuitBreaker.getState() != CircuitBreaker.State.FORCED_OPEN) {
            return false;
        }
        if (circuitBreaker.tryAcquirePermission()) {
            circuitBreaker.releasePermission();
            return false;
        }
        return true;
    }

    public BreakerState getState() {
        return BreakerState.from(circuitBreaker.getState());
    }

    public String getName() {
        return name;
    }

    public BreakerMetrics getMetrics() {
        return metrics;
    }

    public Optional<Function<T, R>> getFallback() {
        return Optional.ofNullable(fallback);
    }

    void shutdown() {
        circuitBreaker.transitionToDisabledState();
    }

    private R fallbackOrThrow(T input, RuntimeException failure) {
        if (fallback == null) {
            throw failure;
        }
        metrics.recordFallback();
        count("fallback");
        log.debug("Breaker {} returning fallback", name);
        return fallback.apply(input);
    }

    private void count(String outcome) {
        meterRegistry.counter("fleet.breaker.calls", "breaker", name, "outcome", outcome).increment();
    }
}
