package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * Connection and configuration lifecycle transitions.
 */
public record SessionLifecycleEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        CONFIG_LOADED,
        CONFIG_REJECTED
    }
}
