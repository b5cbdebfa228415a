package com.locofleet.common.alerting;

/**
 * Outbound destination for alerts (webhook, chat, pager...).
 */
public interface AlertChannel {

    String getName();

    boolean isEnabled();

    /**
     * Delivers the alert. Implementations must bound their own network time.
     *
     * @throws RuntimeException on delivery failure; the caller logs and carries on
     */
    void dispatch(Alert alert);
}
