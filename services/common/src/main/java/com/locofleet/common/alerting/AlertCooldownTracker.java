package com.locofleet.common.alerting;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Remembers when each cooldown key last fired and admits a key at most once per window.
 */
@Slf4j
public class AlertCooldownTracker {

    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();
    private final Clock clock;

    public AlertCooldownTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Atomically checks and claims the key.
     *
     * @return true if the alert may be sent, false if it falls inside the window
     */
    public boolean tryAcquire(String key, Duration window) {
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        lastSent.compute(key, (k, previous) -> {
            if (previous != null && Duration.between(previous, now).compareTo(window) < 0) {
                return previous;
            }
            admitted.set(true);
            return now;
        });
        if (!admitted.get()) {
            log.debug("Alert suppressed by cooldown: {}", key);
        }
        return admitted.get();
    }

    public void clear(String key) {
        lastSent.remove(key);
    }

    public void clearAll() {
        lastSent.clear();
    }

    public int size() {
        return lastSent.size();
    }
}
