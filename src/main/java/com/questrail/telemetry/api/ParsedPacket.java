package com.questrail.telemetry.api;

import java.util.Objects;

/**
 * A single identified packet recovered from the instrument stream.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code id} - the packet id, always one of the configured packet ids</li>
 *   <li>{@code value} - the decoded payload</li>
 *   <li>{@code parseTimeNanos} - monotonic timestamp taken when the packet was decoded</li>
 *   <li>{@code sequenceIndex} - per-connection emission counter, starting at 0</li>
 * </ul>
 *
 * Instances are immutable once emitted.
 */
public record ParsedPacket(
        String id,
        PacketValue value,
        long parseTimeNanos,
        long sequenceIndex
) {
    public ParsedPacket {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must be >= 0");
        }
    }

    /**
     * Returns a copy of this packet carrying a different value.
     * Used when a filter transforms the payload.
     */
    public ParsedPacket withValue(PacketValue newValue) {
        return new ParsedPacket(id, newValue, parseTimeNanos, sequenceIndex);
    }

    /**
     * Plain text line for the raw monitor display.
     */
    public String plaintext() {
        return id + ": " + value.render();
    }
}
