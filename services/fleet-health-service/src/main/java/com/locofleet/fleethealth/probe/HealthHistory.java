package com.locofleet.fleethealth.probe;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-instance ring buffer of the most recent probe outcomes.
 */
class HealthHistory {

    private final int capacity;
    private final Map<String, Deque<HealthHistoryEntry>> entries = new ConcurrentHashMap<>();

    HealthHistory(int capacity) {
        this.capacity = capacity;
    }

    void record(HealthResult result) {
        Deque<HealthHistoryEntry> buffer = entries.computeIfAbsent(result.getInstanceId(), id -> new ArrayDeque<>());
        synchronized (buffer) {
            buffer.addLast(HealthHistoryEntry.of(result));
            while (buffer.size() > capacity) {
                buffer.removeFirst();
            }
        }
    }

    List<HealthHistoryEntry> get(String instanceId) {
        Deque<HealthHistoryEntry> buffer = entries.get(instanceId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    Map<String, List<HealthHistoryEntry>> all() {
        Map<String, List<HealthHistoryEntry>> copy = new LinkedHashMap<>();
        entries.keySet().stream().sorted().forEach(id -> copy.put(id, get(id)));
        return copy;
    }
}
