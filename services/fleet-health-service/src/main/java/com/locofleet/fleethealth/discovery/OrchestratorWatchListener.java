package com.locofleet.fleethealth.discovery;

public interface OrchestratorWatchListener {

    void onEvent(ChangeType type, String resourceName);

    /**
     * The watch channel ended.
     *
     * @param cause failure that closed the channel, or null when it ended gracefully
     */
    void onClose(Exception cause);
}
