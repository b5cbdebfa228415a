package com.locofleet.common.resilience;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
