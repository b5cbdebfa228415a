package com.locofleet.fleethealth.discovery;

public enum SnapshotSource {
    /** Fetched from the orchestrator by the most recent query. */
    LIVE,
    /** Previous snapshot (or none) served because the orchestrator could not be queried. */
    CACHED_FALLBACK
}
