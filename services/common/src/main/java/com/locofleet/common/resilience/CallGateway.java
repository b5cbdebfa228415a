package com.locofleet.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-scoped registry of named breakers protecting calls to external dependencies.
 * <p>
 * One instance is created at startup and injected wherever a protected call is made.
 * Breakers are deduplicated by name: the first {@code createBreaker} call for a name wins,
 * later calls return the existing breaker.
 */
@Slf4j
public class CallGateway {

    private final CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    private final Map<String, Breaker<?, ?>> breakers = new ConcurrentHashMap<>();
    private final Map<String, BreakerMetrics> metrics = new ConcurrentHashMap<>();
    private final List<BreakerTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CallGateway(ExecutorService executor, MeterRegistry meterRegistry, Clock clock) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public <T, R> Breaker<T, R> createBreaker(String name, Function<T, R> operation, BreakerSettings settings) {
        return createBreaker(name, operation, settings, null);
    }

    /**
     * Registers a breaker or returns the one already registered under {@code name}.
     *
     * @param fallback value source used while open or after a failed call; may be null
     */
    @SuppressWarnings("unchecked")
    public <T, R> Breaker<T, R> createBreaker(String name,
                                              Function<T, R> operation,
                                              BreakerSettings settings,
                                              Function<T, R> fallback) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("breaker name must not be blank");
        }
        return (Breaker<T, R>) breakers.computeIfAbsent(name, key -> build(key, operation, settings, fallback));
    }

    public <T, R> Optional<Breaker<T, R>> getBreaker(String name) {
        @SuppressWarnings("unchecked")
        Breaker<T, R> breaker = (Breaker<T, R>) breakers.get(name);
        return Optional.ofNullable(breaker);
    }

    public void addTransitionListener(BreakerTransitionListener listener) {
        listeners.add(listener);
    }

    public Optional<BreakerMetrics> getMetrics(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public Map<String, BreakerMetrics> getAllMetrics() {
        return Map.copyOf(metrics);
    }

    /**
     * Breakers currently not closed, keyed by name.
     */
    public Map<String, BreakerState> openBreakers() {
        return breakers.values().stream()
            .filter(breaker -> breaker.getState() != BreakerState.CLOSED)
            .collect(Collectors.toMap(Breaker::getName, Breaker::getState));
    }

    public BreakerSummary getSummary() {
        int open = 0;
        int halfOpen = 0;
        int closed = 0;
        long requests = 0;
        long failures = 0;
        for (Breaker<?, ?> breaker : breakers.values()) {
            switch (breaker.getState()) {
                case OPEN -> open++;
                case HALF_OPEN -> halfOpen++;
                default -> closed++;
            }
            requests += breaker.getMetrics().getTotalRequests();
            failures += breaker.getMetrics().getTotalFailures();
        }
        return BreakerSummary.builder()
            .totalBreakers(breakers.size())
            .openBreakers(open)
            .halfOpenBreakers(halfOpen)
            .closedBreakers(closed)
            .totalRequests(requests)
            .totalFailures(failures)
            .overallErrorRate(requests > 0 ? (failures * 100.0) / requests : 0.0)
            .build();
    }

    /**
     * Fallback that always answers with the same value.
     */
    public static <T, R> Function<T, R> createCacheFallback(Supplier<R> fallbackData, String description) {
        return input -> {
            log.info("Using fallback: {}", description);
            return fallbackData.get();
        };
    }

    public void shutdown() {
        breakers.forEach((name, breaker) -> {
            try {
                breaker.shutdown();
                log.info("Circuit breaker shutdown: {}", name);
            } catch (RuntimeException e) {
                log.warn("Failed to shutdown circuit breaker {}: {}", name, e.getMessage());
            }
        });
        breakers.clear();
        metrics.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Gateway executor did not terminate within grace period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <T, R> Breaker<T, R> build(String name,
                                       Function<T, R> operation,
                                       BreakerSettings settings,
                                       Function<T, R> fallback) {
        settings.validate();

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(settings.getErrorThresholdPercentage())
            .slidingWindowType(settings.getWindowType() == WindowType.COUNT_BASED
                ? CircuitBreakerConfig.SlidingWindowType.COUNT_BASED
                : CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
            .slidingWindowSize(settings.slidingWindowSize())
            .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
            .waitDurationInOpenState(settings.getResetTimeout())
            .permittedNumberOfCallsInHalfOpenState(1)
            // Evaluated on the next call or isOpen() check, no background timer
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .build();

        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(name, config);
        TimeLimiter timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
            .timeoutDuration(settings.getCallTimeout())
            .cancelRunningFuture(true)
            .build());

        BreakerMetrics breakerMetrics = new BreakerMetrics(name, clock.instant());
        metrics.put(name, breakerMetrics);

        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            BreakerState from = BreakerState.from(event.getStateTransition().getFromState());
            BreakerState to = BreakerState.from(event.getStateTransition().getToState());
            onTransition(name, from, to, breakerMetrics);
        });

        log.info("Circuit breaker created: {} (threshold={}%, window={}x{}, resetTimeout={}, timeout={})",
            name, settings.getErrorThresholdPercentage(), settings.getWindowType(), settings.slidingWindowSize(),
            settings.getResetTimeout(), settings.getCallTimeout());

        return new Breaker<>(name, operation, fallback, circuitBreaker, timeLimiter, executor,
            breakerMetrics, meterRegistry);
    }

    private void onTransition(String name, BreakerState from, BreakerState to, BreakerMetrics breakerMetrics) {
        if (from == to) {
            return;
        }
        breakerMetrics.recordTransition(to, clock.instant());
        meterRegistry.counter("fleet.breaker.transitions", "breaker", name, "state", to.name()).increment();

        switch (to) {
            case OPEN -> log.warn("Circuit breaker OPENED: {}", name);
            case HALF_OPEN -> log.info("Circuit breaker HALF-OPEN: {}", name);
            case CLOSED -> log.info("Circuit breaker CLOSED: {}", name);
        }

        for (BreakerTransitionListener listener : listeners) {
            try {
                listener.onTransition(name, from, to);
            } catch (RuntimeException e) {
                log.error("Breaker transition listener failed for {}", name, e);
            }
        }
    }
}
