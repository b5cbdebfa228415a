package com.locofleet.fleethealth.discovery;

import com.locofleet.common.resilience.Breaker;
import com.locofleet.common.resilience.BreakerSettings;
import com.locofleet.common.resilience.CallGateway;
import com.locofleet.fleethealth.config.FleetMonitorProperties;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * TTL cache of the fleet membership.
 * <p>
 * Orchestrator queries go through the {@code orchestrator.list-instances} breaker. A failed
 * or short-circuited query never surfaces to callers: the last good snapshot is served,
 * marked {@link SnapshotSource#CACHED_FALLBACK}. Watch events only invalidate the cache;
 * the snapshot itself is written exclusively by a successful query.
 */
@Slf4j
@Service
public class DiscoveryCache {

    public static final String LIST_BREAKER = "orchestrator.list-instances";
    public static final String CLUSTER_BREAKER = "orchestrator.cluster-info";

    static final int MAX_WATCH_RECONNECTS = 1;

    private final OrchestratorClient orchestratorClient;
    private final PodInstanceMapper mapper;
    private final Clock clock;
    private final Duration cacheTtl;
    private final String labelSelector;
    private final Map<String, String> selector;
    private final Breaker<Map<String, String>, DiscoverySnapshot> listBreaker;
    private final Breaker<Map<String, String>, ClusterInfo> clusterBreaker;
    private final Map<String, String> clusterSelector;

    private final AtomicReference<DiscoverySnapshot> snapshot = new AtomicReference<>(DiscoverySnapshot.empty());
    private final ReentrantLock fetchLock = new ReentrantLock();
    private volatile boolean invalidated = true;
    private volatile Instant lastFetch;
    private volatile ChangeStream activeStream;

    public DiscoveryCache(OrchestratorClient orchestratorClient,
                          PodInstanceMapper mapper,
                          CallGateway callGateway,
                          FleetMonitorProperties properties,
                          Clock clock) {
        this.orchestratorClient = orchestratorClient;
        this.mapper = mapper;
        this.clock = clock;
        this.cacheTtl = properties.getDiscovery().getCacheTtl();
        this.labelSelector = properties.getDiscovery().getLabelSelector();
        this.selector = properties.getDiscovery().selectorLabels();
        this.listBreaker = callGateway.createBreaker(LIST_BREAKER,
            this::fetchLive,
            BreakerSettings.builder()
                .callTimeout(properties.getDiscovery().getRequestTimeout())
                .build(),
            labels -> snapshot.get().asFallback());
        this.clusterSelector = properties.getDiscovery().clusterSelectorLabels();
        this.clusterBreaker = callGateway.createBreaker(CLUSTER_BREAKER,
            this::fetchClusterInfo,
            BreakerSettings.builder()
                .callTimeout(properties.getDiscovery().getRequestTimeout())
                .build(),
            labels -> ClusterInfo.unavailable("Orchestrator unavailable", clock.instant()));
    }

    /**
     * Current fleet membership. Never throws.
     */
    public DiscoverySnapshot discoverInstances() {
        if (isFresh()) {
            return snapshot.get();
        }
        fetchLock.lock();
        try {
            if (isFresh()) {
                return snapshot.get();
            }
            // Cleared before the query so a watch event arriving mid-fetch forces another one
            invalidated = false;
            DiscoverySnapshot result = listBreaker.fire(selector);
            if (result.isLive()) {
                snapshot.set(result);
                lastFetch = result.getFetchedAt();
                log.info("Discovered {} instances in namespace {}", result.size(), orchestratorClient.getNamespace());
            } else {
                invalidated = true;
                markFallback();
                log.warn("Instance discovery unavailable, serving {} cached instances", result.size());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Instance discovery failed unexpectedly", e);
            invalidated = true;
            return markFallback();
        } finally {
            fetchLock.unlock();
        }
    }

    /**
     * Forces the next {@link #discoverInstances()} to query the orchestrator.
     */
    public void invalidate() {
        invalidated = true;
    }

    public DiscoverySnapshot refreshDiscovery() {
        invalidate();
        return discoverInstances();
    }

    /**
     * Current snapshot; queries the orchestrator only when nothing has been fetched yet. A
     * snapshot older than the TTL is returned as {@link SnapshotSource#CACHED_FALLBACK}.
     */
    public DiscoverySnapshot getInstances() {
        DiscoverySnapshot current = snapshot.get();
        if (!current.hasHistory()) {
            return discoverInstances();
        }
        return current.isLive() && isExpired(current) ? current.asFallback() : current;
    }

    public Optional<FleetInstance> findInstance(String instanceId) {
        return snapshot.get().findById(instanceId);
    }

    /**
     * Subscribes to orchestrator change notifications. Events invalidate the cache and are
     * forwarded to {@code listener}. A dropped channel is re-established once; after that, or
     * when the orchestrator cannot watch, the returned stream is inactive and discovery relies
     * on polling alone.
     */
    public ChangeStream watch(Consumer<InstanceChangeEvent> listener) {
        ChangeStream stream = new ChangeStream();
        openWatch(stream, listener);
        activeStream = stream;
        return stream;
    }

    /**
     * StatefulSet replica counts and fleet services, queried on every call. Never throws.
     */
    public ClusterInfo getClusterInfo() {
        try {
            return clusterBreaker.fire(clusterSelector);
        } catch (RuntimeException e) {
            log.warn("Cluster diagnostics unavailable: {}", e.getMessage());
            return ClusterInfo.unavailable(e.getMessage(), clock.instant());
        }
    }

    public DiscoveryInfo getDiscoveryInfo() {
        DiscoverySnapshot current = snapshot.get();
        ChangeStream stream = activeStream;
        return DiscoveryInfo.builder()
            .namespace(orchestratorClient.getNamespace())
            .labelSelector(labelSelector)
            .lastFetch(lastFetch)
            .cachedInstances(current.size())
            .source(current.getSource())
            .cacheTtl(cacheTtl)
            .watchActive(stream != null && stream.isActive())
            .breakerState(listBreaker.getState())
            .cluster(getClusterInfo())
            .build();
    }

    private boolean isFresh() {
        Instant fetched = lastFetch;
        return !invalidated
            && fetched != null
            && Duration.between(fetched, clock.instant()).compareTo(cacheTtl) < 0;
    }

    private boolean isExpired(DiscoverySnapshot current) {
        return Duration.between(current.getFetchedAt(), clock.instant()).compareTo(cacheTtl) >= 0;
    }

    private DiscoverySnapshot markFallback() {
        return snapshot.updateAndGet(DiscoverySnapshot::asFallback);
    }

    private DiscoverySnapshot fetchLive(Map<String, String> labels) {
        List<Pod> pods = orchestratorClient.listInstances(labels);
        Instant now = clock.instant();
        DiscoverySnapshot previous = snapshot.get();

        Map<Integer, FleetInstance> byOrdinal = new TreeMap<>();
        for (Pod pod : pods) {
            String name = pod.getMetadata() != null ? pod.getMetadata().getName() : null;
            Instant discoveredAt = previous.findByResourceName(String.valueOf(name))
                .map(FleetInstance::getDiscoveredAt)
                .orElse(now);
            mapper.toInstance(pod, discoveredAt).ifPresent(instance -> {
                FleetInstance existing = byOrdinal.putIfAbsent(instance.getOrdinal(), instance);
                if (existing != null) {
                    log.warn("Dropping {}: ordinal {} already taken by {}",
                        instance.getResourceName(), instance.getOrdinal(), existing.getResourceName());
                }
            });
        }
        return DiscoverySnapshot.live(List.copyOf(byOrdinal.values()), now);
    }

    private ClusterInfo fetchClusterInfo(Map<String, String> labels) {
        List<WorkloadInfo> statefulSets = orchestratorClient.listWorkloads(labels);
        List<ServiceEndpointInfo> services = orchestratorClient.listServices(labels);
        statefulSets.stream()
            .filter(workload -> !workload.isFullyReady())
            .forEach(workload -> log.info("StatefulSet {} has {}/{} replicas ready",
                workload.getName(), workload.getReadyReplicas(), workload.getReplicas()));
        return ClusterInfo.builder()
            .available(true)
            .statefulSets(statefulSets)
            .services(services)
            .fetchedAt(clock.instant())
            .build();
    }

    private void openWatch(ChangeStream stream, Consumer<InstanceChangeEvent> listener) {
        try {
            Closeable handle = orchestratorClient.watch(selector, new OrchestratorWatchListener() {
                @Override
                public void onEvent(ChangeType type, String resourceName) {
                    invalidate();
                    InstanceChangeEvent event = new InstanceChangeEvent(type, resourceName, clock.instant());
                    stream.publish(event);
                    log.debug("Instance {} {}, discovery cache invalidated", resourceName, type);
                    try {
                        listener.accept(event);
                    } catch (RuntimeException e) {
                        log.warn("Instance change listener failed: {}", e.getMessage());
                    }
                }

                @Override
                public void onClose(Exception cause) {
                    handleWatchClosed(stream, listener, cause);
                }
            });
            stream.attach(handle);
            log.info("Watching instances in namespace {} ({})", orchestratorClient.getNamespace(), labelSelector);
        } catch (UnsupportedOperationException e) {
            log.info("Orchestrator does not support watches, discovery is polling-only");
            stream.degrade();
        } catch (RuntimeException e) {
            log.warn("Could not establish instance watch, discovery is polling-only: {}", e.getMessage());
            stream.degrade();
        }
    }

    private void handleWatchClosed(ChangeStream stream, Consumer<InstanceChangeEvent> listener, Exception cause) {
        if (stream.isClosed()) {
            return;
        }
        // Events may have been missed while the channel was down
        invalidate();
        if (stream.tryReconnect(MAX_WATCH_RECONNECTS)) {
            log.info("Instance watch closed ({}), re-establishing",
                cause != null ? cause.getMessage() : "server closed channel");
            openWatch(stream, listener);
        } else {
            log.warn("Instance watch closed again, discovery is polling-only");
            stream.degrade();
        }
    }
}
