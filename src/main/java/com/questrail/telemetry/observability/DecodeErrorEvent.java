package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * Record representing an unexpected fault in the decoding pipeline.
 */
public record DecodeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
