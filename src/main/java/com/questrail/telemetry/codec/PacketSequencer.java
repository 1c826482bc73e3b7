package com.questrail.telemetry.codec;

import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.internal.time.MonotonicClock;

import java.util.Objects;

/**
 * Stamps decoded packets with their parse time and sequence index.
 *
 * <p>One sequencer belongs to one connection; indices start at 0 and increase
 * by one per emitted packet.</p>
 */
public final class PacketSequencer
{
    private final MonotonicClock clock;
    private long nextIndex;

    public PacketSequencer(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ParsedPacket emit(String id, PacketValue value) {
        return new ParsedPacket(id, value, clock.nowNanos(), nextIndex++);
    }

    public long emitted() {
        return nextIndex;
    }
}
