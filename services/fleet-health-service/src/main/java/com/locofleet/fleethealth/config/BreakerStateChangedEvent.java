package com.locofleet.fleethealth.config;

import com.locofleet.common.resilience.BreakerState;
import org.springframework.context.ApplicationEvent;

public class BreakerStateChangedEvent extends ApplicationEvent {

    private final String breakerName;
    private final BreakerState from;
    private final BreakerState to;

    public BreakerStateChangedEvent(Object source, String breakerName, BreakerState from, BreakerState to) {
        super(source);
        this.breakerName = breakerName;
        this.from = from;
        this.to = to;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public BreakerState getFrom() {
        return from;
    }

    public BreakerState getTo() {
        return to;
    }
}
