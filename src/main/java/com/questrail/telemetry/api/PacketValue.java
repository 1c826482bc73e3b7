package com.questrail.telemetry.api;

/**
 * Decoded payload of a {@link ParsedPacket}.
 *
 * <p>
 * The variant depends on the wire encoding that produced the packet:
 * </p>
 * <ul>
 *   <li>{@link TextValue} for the delimited text formats (types 0 and 1)</li>
 *   <li>{@link NumericValue} for the fixed-length binary formats (types 2 and 3)</li>
 *   <li>{@link BytesValue} for raw byte sequences handed back by a filter transform</li>
 * </ul>
 *
 * <p>
 * {@link #render()} is the canonical text form used for display, CSV capture
 * and inline x-coordinates.
 * </p>
 */
public sealed interface PacketValue
        permits TextValue, NumericValue, BytesValue {

    /**
     * Returns the canonical text rendering of this value.
     */
    String render();

    static PacketValue of(String text) {
        return new TextValue(text);
    }

    static PacketValue of(long number) {
        return NumericValue.of(number);
    }
}
