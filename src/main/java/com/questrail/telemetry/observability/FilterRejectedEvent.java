package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * A packet dropped by the filter stage. {@code cause} is set when the external
 * filter threw.
 */
public record FilterRejectedEvent(
    Instant timestamp,
    String packetId,
    String reason,
    Throwable cause
) {
}
