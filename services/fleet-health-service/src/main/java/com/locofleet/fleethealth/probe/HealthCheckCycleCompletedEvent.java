package com.locofleet.fleethealth.probe;

import org.springframework.context.ApplicationEvent;

public class HealthCheckCycleCompletedEvent extends ApplicationEvent {

    private final HealthCheckCycle cycle;

    public HealthCheckCycleCompletedEvent(Object source, HealthCheckCycle cycle) {
        super(source);
        this.cycle = cycle;
    }

    public HealthCheckCycle getCycle() {
        return cycle;
    }
}
