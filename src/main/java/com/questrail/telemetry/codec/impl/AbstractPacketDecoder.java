package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.codec.PacketDecoder;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.FormatType;
import com.questrail.telemetry.observability.DecodeObservabilitySink;
import com.questrail.telemetry.observability.DecodeResyncEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Shared poll loop for the four decoders.
 *
 * <pre>
 *   next unit (fragment or frame)
 *        → decodeUnit
 *            → packet            : returned
 *            → nothing           : try the next unit
 *            → DecodeResync      : report, drop, try the next unit
 * </pre>
 *
 * @param <U> unit type: {@code String} fragments or {@code BitFrame}s
 */
abstract class AbstractPacketDecoder<U> implements PacketDecoder
{
    protected final PacketSequencer sequencer;
    private final DecodeObservabilitySink sink;

    AbstractPacketDecoder(PacketSequencer sequencer, DecodeObservabilitySink sink) {
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public final Optional<ParsedPacket> poll() {
        return poll(() -> false);
    }

    @Override
    public final Optional<ParsedPacket> poll(BooleanSupplier stop) {
        Objects.requireNonNull(stop, "stop");
        while (!stop.getAsBoolean()) {
            Optional<U> unit = nextUnit();
            if (unit.isEmpty()) {
                return Optional.empty();
            }
            try {
                Optional<ParsedPacket> packet = decodeUnit(unit.get());
                if (packet.isPresent()) {
                    return packet;
                }
            }
            catch (DecodeResyncException e) {
                sink.onResync(new DecodeResyncEvent(Instant.now(), format(), e.getMessage(), describe(unit.get())));
            }
        }
        return Optional.empty();
    }

    /**
     * Reports a dropped unit without interrupting the current one.
     */
    protected final void reportResync(String reason, String unit) {
        sink.onResync(new DecodeResyncEvent(Instant.now(), format(), reason, unit));
    }

    protected abstract FormatType format();

    /**
     * @return the next buffered unit, or empty when more input is needed
     */
    protected abstract Optional<U> nextUnit();

    /**
     * @return a packet, or empty if the unit was consumed without producing one
     * @throws DecodeResyncException if the unit fails the format's rules
     */
    protected abstract Optional<ParsedPacket> decodeUnit(U unit);

    protected String describe(U unit) {
        return String.valueOf(unit);
    }
}
