package com.questrail.telemetry.api;

import java.util.Objects;

/**
 * A plotted point: {@code (seriesId, x, y)}.
 *
 * <p>{@code x} is numeric in time and index ordering, and is the index packet's
 * value (verbatim) in inline ordering.</p>
 */
public record Sample(String seriesId, PacketValue x, PacketValue y)
{
    public Sample {
        Objects.requireNonNull(seriesId, "seriesId");
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }
}
