package com.locofleet.fleethealth.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChangeStream")
class ChangeStreamTest {

    private static InstanceChangeEvent event(int n) {
        return new InstanceChangeEvent(ChangeType.MODIFIED, "loco-emulator-" + n, Instant.EPOCH.plusSeconds(n));
    }

    @Test
    @DisplayName("drops the oldest events when the buffer is full")
    void shouldDropOldestWhenFull() {
        ChangeStream stream = new ChangeStream();
        for (int i = 0; i < ChangeStream.CAPACITY + 10; i++) {
            stream.publish(event(i));
        }

        List<InstanceChangeEvent> drained = stream.drain();

        assertThat(drained).hasSize(ChangeStream.CAPACITY);
        assertThat(drained.get(0).getResourceName()).isEqualTo("loco-emulator-10");
    }

    @Test
    @DisplayName("polls buffered events in arrival order")
    void shouldPollInOrder() throws InterruptedException {
        ChangeStream stream = new ChangeStream();
        stream.publish(event(1));
        stream.publish(event(2));

        assertThat(stream.poll(Duration.ofMillis(10))).contains(event(1));
        assertThat(stream.poll(Duration.ofMillis(10))).contains(event(2));
        assertThat(stream.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    @DisplayName("stops the underlying watch when closed")
    void shouldCloseHandle() {
        AtomicInteger closes = new AtomicInteger();
        Closeable handle = closes::incrementAndGet;
        ChangeStream stream = new ChangeStream();
        stream.attach(handle);
        assertThat(stream.isActive()).isTrue();

        stream.close();
        stream.close();

        assertThat(closes).hasValue(1);
        assertThat(stream.isActive()).isFalse();
        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    @DisplayName("grants a bounded number of reconnects")
    void shouldBoundReconnects() {
        ChangeStream stream = new ChangeStream();

        assertThat(stream.tryReconnect(1)).isTrue();
        assertThat(stream.tryReconnect(1)).isFalse();
        assertThat(stream.getReconnectCount()).isEqualTo(1);
    }
}
