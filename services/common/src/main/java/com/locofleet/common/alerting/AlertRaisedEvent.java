package com.locofleet.common.alerting;

import org.springframework.context.ApplicationEvent;

/**
 * Published for every alert that passed the cooldown, after channel dispatch.
 */
public class AlertRaisedEvent extends ApplicationEvent {

    private final Alert alert;

    public AlertRaisedEvent(Object source, Alert alert) {
        super(source);
        this.alert = alert;
    }

    public Alert getAlert() {
        return alert;
    }
}
