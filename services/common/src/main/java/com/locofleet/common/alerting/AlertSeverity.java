package com.locofleet.common.alerting;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
