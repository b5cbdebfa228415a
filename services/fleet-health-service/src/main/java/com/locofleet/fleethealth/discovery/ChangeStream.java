package com.locofleet.fleethealth.discovery;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumer side of an instance watch. Events are buffered (oldest dropped when full) and
 * can be polled; closing the stream stops the underlying watch.
 * <p>
 * An inactive stream means discovery is running in polling-only mode.
 */
@Slf4j
public class ChangeStream implements Closeable {

    static final int CAPACITY = 256;

    private final BlockingQueue<InstanceChangeEvent> events = new LinkedBlockingQueue<>(CAPACITY);
    private final AtomicReference<Closeable> handle = new AtomicReference<>();
    private final AtomicInteger reconnects = new AtomicInteger();
    private volatile boolean active;
    private volatile boolean closed;

    void attach(Closeable watchHandle) {
        Closeable previous = handle.getAndSet(watchHandle);
        closeHandle(previous);
        active = true;
        if (closed) {
            closeHandle(handle.getAndSet(null));
            active = false;
        }
    }

    void publish(InstanceChangeEvent event) {
        while (!events.offer(event)) {
            events.poll();
        }
    }

    void degrade() {
        active = false;
        closeHandle(handle.getAndSet(null));
    }

    /**
     * Claims one reconnect if fewer than {@code max} have been used.
     */
    boolean tryReconnect(int max) {
        return reconnects.getAndUpdate(count -> count < max ? count + 1 : count) < max;
    }

    public Optional<InstanceChangeEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public List<InstanceChangeEvent> drain() {
        List<InstanceChangeEvent> drained = new ArrayList<>();
        events.drainTo(drained);
        return drained;
    }

    public boolean isActive() {
        return active && !closed;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getReconnectCount() {
        return reconnects.get();
    }

    @Override
    public void close() {
        closed = true;
        active = false;
        closeHandle(handle.getAndSet(null));
    }

    private static void closeHandle(Closeable watchHandle) {
        if (watchHandle == null) {
            return;
        }
        try {
            watchHandle.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to close instance watch: {}", e.getMessage());
        }
    }
}
