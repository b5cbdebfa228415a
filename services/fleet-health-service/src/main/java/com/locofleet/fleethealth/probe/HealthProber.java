package com.locofleet.fleethealth.probe;

import com.locofleet.common.alerting.AlertService;
import com.locofleet.common.alerting.AlertSeverity;
import com.locofleet.common.exception.BreakerOpenException;
import com.locofleet.common.exception.GatewayCallException;
import com.locofleet.common.exception.MalformedHealthPayloadException;
import com.locofleet.common.resilience.BackoffRetry;
import com.locofleet.common.resilience.Breaker;
import com.locofleet.common.resilience.BreakerSettings;
import com.locofleet.common.resilience.BreakerState;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.common.resilience.Sleeper;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.DiscoverySnapshot;
import com.locofleet.fleethealth.discovery.FleetInstance;
import com.locofleet.fleethealth.recovery.FailureClassification;
import com.locofleet.fleethealth.recovery.FailureClassifier;
import com.locofleet.fleethealth.recovery.RecoveryOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deep health probing of every discovered instance.
 * <p>
 * Each instance has its own breaker ({@code health-probe:<id>}); while it is open the
 * instance is skipped without network I/O. A probe retries with exponential backoff before
 * it is counted as one failure against that breaker.
 */
@Slf4j
@Service
public class HealthProber {

    public static final String PROBE_BREAKER_PREFIX = "health-probe:";

    private final DiscoveryCache discoveryCache;
    private final InstanceAgentClient agentClient;
    private final HealthAnalyzer healthAnalyzer;
    private final FailureClassifier failureClassifier;
    private final RecoveryOrchestrator recoveryOrchestrator;
    private final AlertService alertService;
    private final CallGateway callGateway;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService probeExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final BackoffRetry retry;
    private final BreakerSettings breakerSettings;
    private final Duration cycleTimeout;
    private final Duration slowResponseThreshold;
    private final HealthHistory history;

    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong successfulChecks = new AtomicLong();
    private final AtomicLong failedChecks = new AtomicLong();
    private final AtomicLong totalResponseTimeMs = new AtomicLong();
    private final Instant uptimeStart;
    private volatile HealthCheckCycle lastCycle;

    public HealthProber(DiscoveryCache discoveryCache,
                        InstanceAgentClient agentClient,
                        HealthAnalyzer healthAnalyzer,
                        FailureClassifier failureClassifier,
                        RecoveryOrchestrator recoveryOrchestrator,
                        AlertService alertService,
                        CallGateway callGateway,
                        ApplicationEventPublisher eventPublisher,
                        @Qualifier("fleetProbeExecutor") ExecutorService probeExecutor,
                        MeterRegistry meterRegistry,
                        Clock clock,
                        Sleeper sleeper,
                        FleetMonitorProperties properties) {
        this.discoveryCache = discoveryCache;
        this.agentClient = agentClient;
        this.healthAnalyzer = healthAnalyzer;
        this.failureClassifier = failureClassifier;
        this.recoveryOrchestrator = recoveryOrchestrator;
        this.alertService = alertService;
        this.callGateway = callGateway;
        this.eventPublisher = eventPublisher;
        this.probeExecutor = probeExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        FleetMonitorProperties.Health health = properties.getHealth();
        this.retry = BackoffRetry.exponential(health.getRetry().getMaxAttempts(),
            health.getRetry().getBaseDelay(), health.getRetry().getMultiplier(), sleeper);
        this.breakerSettings = BreakerSettings.builder()
            .errorThresholdPercentage(health.getBreaker().getErrorThresholdPercentage())
            .minimumNumberOfCalls(health.getBreaker().getMinimumNumberOfCalls())
            .resetTimeout(health.getBreaker().getResetTimeout())
            .rollingWindow(health.getBreaker().getRollingWindow())
            .windowType(health.getBreaker().getWindowType())
            .callTimeout(health.getProbeTimeout())
            .build();
        this.cycleTimeout = health.getCycleTimeout();
        this.slowResponseThreshold = health.getThresholds().getResponseTime();
        this.history = new HealthHistory(health.getHistorySize());
        this.uptimeStart = clock.instant();

        callGateway.addTransitionListener(this::onBreakerTransition);
    }

    /**
     * Probes one instance. Never throws: failures become an {@link HealthStatus#UNHEALTHY} result.
     */
    public HealthResult checkInstanceHealth(FleetInstance instance) {
        String instanceId = instance.getId();
        Breaker<FleetInstance, HealthPayload> breaker = breakerFor(instanceId);
        if (breaker.isOpen()) {
            log.debug("Skipping health check for {}: circuit breaker open", instanceId);
            return HealthResult.breakerOpen(instanceId, clock.instant());
        }

        long start = System.nanoTime();
        try {
            HealthPayload payload = breaker.fire(instance);
            long responseTimeMs = elapsedMs(start);
            HealthAnalysis analysis = healthAnalyzer.analyze(payload);
            FailureClassification classification = failureClassifier.classify(instanceId, payload, analysis);

            recordCheck(true, responseTimeMs);
            if (responseTimeMs > slowResponseThreshold.toMillis()) {
                log.warn("Slow health response from {}: {}ms", instanceId, responseTimeMs);
            }
            raiseScoreAlert(instanceId, analysis);

            return HealthResult.builder()
                .instanceId(instanceId)
                .timestamp(clock.instant())
                .status(HealthStatus.HEALTHY)
                .responseTimeMs(responseTimeMs)
                .payload(payload)
                .analysis(analysis)
                .classification(classification)
                .build();
        } catch (BreakerOpenException e) {
            return HealthResult.breakerOpen(instanceId, clock.instant());
        } catch (GatewayCallException e) {
            long responseTimeMs = elapsedMs(start);
            recordCheck(false, responseTimeMs);
            String reason = describe(e);
            log.warn("Health check failed for {} after {}ms: {}", instanceId, responseTimeMs, reason);
            alertService.sendAlert(AlertSeverity.WARNING, "Health check failed for " + instanceId + ": " + reason,
                instanceId, Map.of("error", reason));

            FailureClassification classification = e.getCause() instanceof MalformedHealthPayloadException
                ? failureClassifier.classifyMalformed(instanceId)
                : failureClassifier.classifyUnreachable(instanceId);
            return HealthResult.builder()
                .instanceId(instanceId)
                .timestamp(clock.instant())
                .status(HealthStatus.UNHEALTHY)
                .responseTimeMs(responseTimeMs)
                .classification(classification)
                .error(reason)
                .build();
        }
    }

    /**
     * Runs one deep health cycle over the current snapshot. Per-instance failures are isolated
     * as results; a failure of the cycle itself raises an ERROR alert and is not rethrown.
     */
    public HealthCheckCycle performHealthChecks() {
        Instant startedAt = clock.instant();
        HealthCheckCycle cycle;
        try {
            DiscoverySnapshot snapshot = discoveryCache.discoverInstances();
            List<HealthResult> results = probeAll(snapshot.getInstances());
            results.forEach(this::recordAndRecover);
            cycle = HealthCheckCycle.of(startedAt, clock.instant(), snapshot.getSource(), results);
            log.info("Health check cycle completed: total={} healthy={} unhealthy={} errors={} breakerOpen={} source={}",
                cycle.getTotal(), cycle.getHealthy(), cycle.getUnhealthy(), cycle.getErrors(),
                cycle.getBreakerOpen(), cycle.getSnapshotSource());
        } catch (RuntimeException e) {
            log.error("Health check cycle failed", e);
            alertService.sendAlert(AlertSeverity.ERROR, "Health check cycle failed: " + e.getMessage());
            cycle = HealthCheckCycle.failed(startedAt, clock.instant(), e.getMessage());
        }

        lastCycle = cycle;
        meterRegistry.counter("fleet.health.cycles", "outcome", cycle.getFailure() == null ? "completed" : "failed")
            .increment();
        try {
            eventPublisher.publishEvent(new HealthCheckCycleCompletedEvent(this, cycle));
        } catch (RuntimeException e) {
            log.error("Failed to publish health check cycle event", e);
        }
        return cycle;
    }

    public List<HealthHistoryEntry> getHealthHistory(String instanceId) {
        return history.get(instanceId);
    }

    public Map<String, List<HealthHistoryEntry>> getAllHistory() {
        return history.all();
    }

    public Optional<HealthCheckCycle> getLastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    public ProbeMetrics getMetrics() {
        long total = totalChecks.get();
        return ProbeMetrics.builder()
            .totalChecks(total)
            .successfulChecks(successfulChecks.get())
            .failedChecks(failedChecks.get())
            .averageResponseTimeMs(total > 0 ? (double) totalResponseTimeMs.get() / total : 0.0)
            .uptimeStart(uptimeStart)
            .build();
    }

    private List<HealthResult> probeAll(List<FleetInstance> instances) {
        List<CompletableFuture<HealthResult>> futures = new ArrayList<>(instances.size());
        for (FleetInstance instance : instances) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> checkInstanceHealth(instance), probeExecutor));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(
                    HealthResult.error(instance.getId(), clock.instant(), "Probe rejected: executor saturated")));
            }
        }

        long deadline = System.nanoTime() + cycleTimeout.toNanos();
        List<HealthResult> results = new ArrayList<>(instances.size());
        for (int i = 0; i < futures.size(); i++) {
            String instanceId = instances.get(i).getId();
            CompletableFuture<HealthResult> future = futures.get(i);
            try {
                results.add(future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                results.add(HealthResult.error(instanceId, clock.instant(),
                    "Probe did not complete within " + cycleTimeout.toSeconds() + "s"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Health probe for {} failed unexpectedly", instanceId, cause);
                results.add(HealthResult.error(instanceId, clock.instant(), cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.add(HealthResult.error(instanceId, clock.instant(), "Probe interrupted"));
            }
        }
        return results;
    }

    private void recordAndRecover(HealthResult result) {
        history.record(result);
        if (result.getClassification() == null) {
            return;
        }
        try {
            recoveryOrchestrator.submitRecovery(result.getInstanceId(), result.getClassification());
        } catch (RuntimeException e) {
            log.error("Recovery handling failed for {}", result.getInstanceId(), e);
        }
    }

    private Breaker<FleetInstance, HealthPayload> breakerFor(String instanceId) {
        return callGateway.createBreaker(PROBE_BREAKER_PREFIX + instanceId,
            instance -> retry.execute("health probe " + instance.getId(), () -> agentClient.fetchHealth(instance)),
            breakerSettings);
    }

    private void raiseScoreAlert(String instanceId, HealthAnalysis analysis) {
        switch (analysis.getSlaStatus()) {
            case CRITICAL -> alertService.sendAlert(AlertSeverity.CRITICAL,
                "Instance " + instanceId + " health score critical: " + analysis.getScore(), instanceId,
                Map.of("score", analysis.getScore(), "issues", analysis.getIssues()));
            case DEGRADED -> alertService.sendAlert(AlertSeverity.WARNING,
                "Instance " + instanceId + " health degraded: " + analysis.getScore(), instanceId,
                Map.of("score", analysis.getScore(), "issues", analysis.getIssues()));
            default -> {
            }
        }
    }

    private void onBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
        if (to == BreakerState.OPEN && breakerName.startsWith(PROBE_BREAKER_PREFIX)) {
            String instanceId = breakerName.substring(PROBE_BREAKER_PREFIX.length());
            alertService.sendAlert(AlertSeverity.CRITICAL, "Circuit breaker opened for instance " + instanceId,
                instanceId, Map.of("breaker", breakerName));
        }
    }

    private void recordCheck(boolean success, long responseTimeMs) {
        totalChecks.incrementAndGet();
        totalResponseTimeMs.addAndGet(responseTimeMs);
        if (success) {
            successfulChecks.incrementAndGet();
        } else {
            failedChecks.incrementAndGet();
        }
        meterRegistry.timer("fleet.health.probe", "outcome", success ? "healthy" : "unhealthy")
            .record(responseTimeMs, TimeUnit.MILLISECONDS);
    }

    private static String describe(GatewayCallException e) {
        if (e.isTimeout()) {
            return "probe timed out";
        }
        Throwable cause = e.getCause();
        return cause != null && cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
