package com.locofleet.common.exception;

/**
 * Exception thrown when the orchestrator cannot be queried for fleet members.
 */
public class DiscoveryUnavailableException extends FleetException {

    private final String namespace;

    public DiscoveryUnavailableException(String message, String namespace) {
        super(message);
        this.namespace = namespace;
    }

    public DiscoveryUnavailableException(String message, String namespace, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }
}
