package com.locofleet.fleethealth.discovery;

import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable view of the fleet. Instances are sorted by ascending, unique ordinal.
 * <p>
 * {@link #empty()} (nothing ever fetched) is distinguishable from a successful query that
 * matched nothing: the former is {@link SnapshotSource#CACHED_FALLBACK} with no
 * {@code fetchedAt}, the latter is {@link SnapshotSource#LIVE}.
 */
@Value
public class DiscoverySnapshot {

    private static final DiscoverySnapshot EMPTY =
        new DiscoverySnapshot(List.of(), null, SnapshotSource.CACHED_FALLBACK);

    List<FleetInstance> instances;
    Instant fetchedAt;
    SnapshotSource source;

    private DiscoverySnapshot(List<FleetInstance> instances, Instant fetchedAt, SnapshotSource source) {
        this.instances = instances;
        this.fetchedAt = fetchedAt;
        this.source = source;
    }

    public static DiscoverySnapshot empty() {
        return EMPTY;
    }

    public static DiscoverySnapshot live(List<FleetInstance> instances, Instant fetchedAt) {
        List<FleetInstance> ordered = instances.stream()
            .sorted(Comparator.comparingInt(FleetInstance::getOrdinal))
            .toList();
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).getOrdinal() == ordered.get(i - 1).getOrdinal()) {
                throw new IllegalArgumentException("Duplicate instance ordinal " + ordered.get(i).getOrdinal());
            }
        }
        return new DiscoverySnapshot(ordered, fetchedAt, SnapshotSource.LIVE);
    }

    /**
     * Same instances and fetch time, marked as served from cache.
     */
    public DiscoverySnapshot asFallback() {
        if (source == SnapshotSource.CACHED_FALLBACK) {
            return this;
        }
        return new DiscoverySnapshot(instances, fetchedAt, SnapshotSource.CACHED_FALLBACK);
    }

    public boolean isLive() {
        return source == SnapshotSource.LIVE;
    }

    /**
     * False when no query has ever succeeded.
     */
    public boolean hasHistory() {
        return fetchedAt != null;
    }

    public int size() {
        return instances.size();
    }

    public Optional<FleetInstance> findById(String instanceId) {
        return instances.stream()
            .filter(instance -> instance.getId().equals(instanceId))
            .findFirst();
    }

    public Optional<FleetInstance> findByResourceName(String resourceName) {
        return instances.stream()
            .filter(instance -> instance.getResourceName().equals(resourceName))
            .findFirst();
    }
}
