package com.locofleet.fleethealth.discovery;

public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
}
