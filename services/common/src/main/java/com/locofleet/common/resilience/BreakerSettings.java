package com.locofleet.common.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning of a single named breaker.
 *
 * <pre>
 * CLOSED    -> OPEN       failure rate >= errorThresholdPercentage over at least
 *                         minimumNumberOfCalls inside the window (rollingWindow, or the
 *                         last minimumNumberOfCalls calls when COUNT_BASED)
 * OPEN      -> HALF_OPEN  on the first call or check after resetTimeout
 * HALF_OPEN -> CLOSED     trial call succeeds
 * HALF_OPEN -> OPEN       trial call fails
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class BreakerSettings {

    @Builder.Default
    float errorThresholdPercentage = 50f;

    @Builder.Default
    Duration resetTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration callTimeout = Duration.ofSeconds(5);

    @Builder.Default
    Duration rollingWindow = Duration.ofSeconds(60);

    @Builder.Default
    int minimumNumberOfCalls = 2;

    @Builder.Default
    WindowType windowType = WindowType.TIME_BASED;

    public static BreakerSettings defaults() {
        return BreakerSettings.builder().build();
    }

    int slidingWindowSize() {
        return windowType == WindowType.COUNT_BASED ? minimumNumberOfCalls : (int) rollingWindow.getSeconds();
    }

    void validate() {
        if (windowType == null) {
            throw new IllegalArgumentException("windowType must not be null");
        }
        if (errorThresholdPercentage <= 0 || errorThresholdPercentage > 100) {
            throw new IllegalArgumentException("errorThresholdPercentage must be in (0, 100]");
        }
        if (resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout must be positive");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (rollingWindow.getSeconds() < 1) {
            throw new IllegalArgumentException("rollingWindow must be at least one second");
        }
        if (minimumNumberOfCalls < 1) {
            throw new IllegalArgumentException("minimumNumberOfCalls must be at least 1");
        }
    }
}
