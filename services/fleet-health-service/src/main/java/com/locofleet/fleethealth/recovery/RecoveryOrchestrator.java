package com.locofleet.fleethealth.recovery;

import com.locofleet.common.alerting.AlertService;
import com.locofleet.common.alerting.AlertSeverity;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.FleetInstance;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives bounded, category-specific recovery of failing instances.
 * <p>
 * Each failing result claims one attempt; after {@code fleet.recovery.max-attempts} failed
 * attempts the instance is left alone and a CRITICAL alert asks for manual intervention.
 * A single healthy result or a manual reset clears the counter. Recovery actions run on the
 * task executor, at most one per instance at a time.
 *
 * @author Loco Fleet Operations
 */
@Slf4j
@Service
public class RecoveryOrchestrator {

    private final DiscoveryCache discoveryCache;
    private final RecoveryActions recoveryActions;
    private final AlertService alertService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor taskExecutor;
    private final RecoveryAttemptTracker tracker;
    private final boolean enabled;
    private final Map<String, CompletableFuture<RecoveryState>> inFlight = new ConcurrentHashMap<>();

    public RecoveryOrchestrator(DiscoveryCache discoveryCache,
                                RecoveryActions recoveryActions,
                                AlertService alertService,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Qualifier("fleetTaskExecutor") Executor taskExecutor,
                                FleetMonitorProperties properties) {
        this.discoveryCache = discoveryCache;
        this.recoveryActions = recoveryActions;
        this.alertService = alertService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
        this.tracker = new RecoveryAttemptTracker(properties.getRecovery().getMaxAttempts());
        this.enabled = properties.getRecovery().isEnabled();
    }

    /**
     * Acts on the latest classification of an instance. Never throws.
     *
     * @return the instance's recovery state afterwards
     */
    public RecoveryState checkForFailuresAndRecover(String instanceId, FailureClassification classification) {
        return recover(instanceId, classification, false);
    }

    /**
     * Asynchronous form of {@link #checkForFailuresAndRecover}. A healthy classification is
     * applied inline; a failing one is handed to the task executor. While a recovery of the
     * instance is running, further requests join it instead of starting another.
     */
    public CompletableFuture<RecoveryState> submitRecovery(String instanceId, FailureClassification classification) {
        if (!classification.isRecoveryNeeded()) {
            return CompletableFuture.completedFuture(recover(instanceId, classification, false));
        }
        return dispatch(instanceId, () -> recover(instanceId, classification, false));
    }

    /**
     * Runs the recovery matching {@code failureType}.
     *
     * @return true if the action succeeded
     */
    public boolean executeRecoveryStrategy(String instanceId, FailureType failureType) {
        if (failureType == FailureType.NONE) {
            return true;
        }
        if (failureType == FailureType.CLIENT) {
            log.warn("Client-side failure on {}: no backend recovery available, manual follow-up required", instanceId);
            return false;
        }
        Optional<FleetInstance> instance = discoveryCache.findInstance(instanceId);
        if (instance.isEmpty()) {
            log.warn("Cannot recover {}: not in the current discovery snapshot", instanceId);
            return false;
        }
        FleetInstance target = instance.get();
        return switch (failureType) {
            case NETWORK -> runAction(target, "network", recoveryActions::recoverNetwork);
            case QEMU -> runAction(target, "subsystem", recoveryActions::recoverSubsystem);
            case MIXED -> runAction(target, "network", recoveryActions::recoverNetwork)
                || runAction(target, "subsystem", recoveryActions::recoverSubsystem);
            default -> false;
        };
    }

    /**
     * Manually triggers recovery using the last known failure type, {@link FailureType#MIXED}
     * when none is known. Runs even when automatic recovery is disabled; the attempt cap applies.
     */
    public CompletableFuture<RecoveryState> triggerRecovery(String instanceId) {
        FailureType failureType = tracker.get(instanceId)
            .map(RecoveryRecord::getLastFailureType)
            .filter(type -> type != FailureType.NONE)
            .orElse(FailureType.MIXED);
        FailureClassification classification = FailureClassification.of(instanceId, failureType, List.of("manual_trigger"));
        log.info("Manual {} recovery requested for {}", failureType.toValue(), instanceId);
        return dispatch(instanceId, () -> recover(instanceId, classification, true));
    }

    public void resetRecovery(String instanceId) {
        int previous = tracker.reset(instanceId, clock.instant());
        alertService.clearCooldown(instanceId, AlertSeverity.CRITICAL);
        log.info("Recovery state of {} reset (was {} attempts)", instanceId, previous);
    }

    public Map<String, RecoveryStatus> getRecoveryStatus() {
        Map<String, RecoveryStatus> status = new LinkedHashMap<>();
        tracker.all().forEach((instanceId, record) -> status.put(instanceId, toStatus(instanceId, record)));
        return status;
    }

    public RecoveryStatus getRecoveryStatus(String instanceId) {
        return toStatus(instanceId, tracker.get(instanceId).orElseGet(() -> RecoveryRecord.builder().build()));
    }

    public int getMaxAttempts() {
        return tracker.getMaxAttempts();
    }

    private RecoveryState recover(String instanceId, FailureClassification classification, boolean manual) {
        Instant now = clock.instant();
        if (!classification.isRecoveryNeeded()) {
            int previous = tracker.reset(instanceId, now);
            if (previous > 0) {
                log.info("Instance {} healthy again after {} recovery attempts", instanceId, previous);
            }
            return RecoveryState.HEALTHY;
        }

        FailureType failureType = classification.getFailureType();
        if (!enabled && !manual) {
            tracker.recordFailure(instanceId, failureType, now);
            log.debug("Auto-recovery disabled, not acting on {} failure of {}", failureType.toValue(), instanceId);
            return currentState(instanceId);
        }

        int max = tracker.getMaxAttempts();
        OptionalInt claimed = tracker.tryBeginAttempt(instanceId, failureType, now);
        if (claimed.isEmpty()) {
            alertExhausted(instanceId, classification);
            return RecoveryState.RECOVERY_EXHAUSTED;
        }

        int attempt = claimed.getAsInt();
        alertService.sendAlert(AlertSeverity.INFO,
            "Attempting " + failureType.toValue() + " recovery for " + instanceId + " (attempt " + attempt + "/" + max + ")",
            instanceId, Map.of("failureType", failureType.toValue(), "issues", classification.getIssues()));

        boolean recovered;
        try {
            recovered = executeRecoveryStrategy(instanceId, failureType);
        } catch (RuntimeException e) {
            log.error("Recovery strategy for {} failed unexpectedly", instanceId, e);
            recovered = false;
        }
        meterRegistry.counter("fleet.recovery.attempts",
            "failureType", failureType.toValue(), "outcome", recovered ? "success" : "failure").increment();

        if (recovered) {
            tracker.reset(instanceId, clock.instant());
            log.info("Recovery of {} succeeded on attempt {}/{}", instanceId, attempt, max);
            return RecoveryState.HEALTHY;
        }

        alertService.sendAlert(AlertSeverity.ERROR,
            "Recovery attempt " + attempt + "/" + max + " failed for " + instanceId,
            instanceId, Map.of("failureType", failureType.toValue()));
        if (attempt >= max) {
            tracker.markExhausted(instanceId, clock.instant());
            alertExhausted(instanceId, classification);
            return RecoveryState.RECOVERY_EXHAUSTED;
        }
        return RecoveryState.RECOVERY_PENDING;
    }

    private CompletableFuture<RecoveryState> dispatch(String instanceId, Supplier<RecoveryState> work) {
        CompletableFuture<RecoveryState> future = new CompletableFuture<>();
        CompletableFuture<RecoveryState> running = inFlight.putIfAbsent(instanceId, future);
        if (running != null) {
            log.debug("Recovery of {} already in progress, not starting another", instanceId);
            return running;
        }
        try {
            taskExecutor.execute(() -> {
                try {
                    RecoveryState state = work.get();
                    inFlight.remove(instanceId, future);
                    future.complete(state);
                } catch (RuntimeException e) {
                    inFlight.remove(instanceId, future);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(instanceId, future);
            log.warn("Recovery of {} not started: task executor saturated", instanceId);
            future.complete(currentState(instanceId));
        }
        return future;
    }

    private RecoveryState currentState(String instanceId) {
        return tracker.get(instanceId).map(RecoveryRecord::getState).orElse(RecoveryState.HEALTHY);
    }

    private boolean runAction(FleetInstance instance, String action, Consumer<FleetInstance> recovery) {
        try {
            recovery.accept(instance);
            log.info("{} recovery dispatched for {}", action, instance.getId());
            return true;
        } catch (RuntimeException e) {
            log.warn("{} recovery failed for {}: {}", action, instance.getId(), e.getMessage());
            return false;
        }
    }

    private void alertExhausted(String instanceId, FailureClassification classification) {
        alertService.sendAlert(AlertSeverity.CRITICAL,
            "Instance " + instanceId + " requires manual intervention: " + tracker.getMaxAttempts()
                + " recovery attempts exhausted",
            instanceId, Map.of("failureType", classification.getFailureType().toValue(),
                "issues", classification.getIssues()));
    }

    private RecoveryStatus toStatus(String instanceId, RecoveryRecord record) {
        return RecoveryStatus.builder()
            .instanceId(instanceId)
            .attempts(record.getAttempts())
            .maxAttempts(tracker.getMaxAttempts())
            .canRecover(record.getAttempts() < tracker.getMaxAttempts())
            .state(record.getState())
            .inProgress(inFlight.containsKey(instanceId))
            .lastFailureType(record.getLastFailureType())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
