package com.questrail.telemetry.observability;

import com.questrail.telemetry.config.FormatType;

import java.time.Instant;

/**
 * A dropped fragment or frame.
 *
 * @param format the wire encoding being decoded
 * @param reason why the unit was dropped
 * @param unit   printable rendering of the dropped unit
 */
public record DecodeResyncEvent(
    Instant timestamp,
    FormatType format,
    String reason,
    String unit
) {
}
