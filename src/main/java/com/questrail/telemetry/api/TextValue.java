package com.questrail.telemetry.api;

import java.util.Objects;

/**
 * Text payload produced by the delimited decoders.
 */
public record TextValue(String text) implements PacketValue
{
    public TextValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String render() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
