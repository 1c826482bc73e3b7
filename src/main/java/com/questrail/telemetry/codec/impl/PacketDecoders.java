package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.codec.PacketDecoder;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.CompressedCsvFormat;
import com.questrail.telemetry.config.EncodedBitsFormat;
import com.questrail.telemetry.config.EncodedCharsFormat;
import com.questrail.telemetry.config.FormatDescriptor;
import com.questrail.telemetry.config.FormatDescriptorVisitor;
import com.questrail.telemetry.config.HumanReadableFormat;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

import java.util.Objects;

/**
 * Selects the decoder variant for a descriptor.
 *
 * <p>Each call builds a fresh decoder with empty state; reconnecting or
 * reloading a configuration simply calls this again.</p>
 */
public final class PacketDecoders
{
    private PacketDecoders() {}

    public static PacketDecoder create(FormatDescriptor descriptor,
                                       PacketSequencer sequencer,
                                       DecodeObservabilitySink sink) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(sequencer, "sequencer");
        Objects.requireNonNull(sink, "sink");

        return descriptor.accept(new FormatDescriptorVisitor<PacketDecoder>() {
            @Override
            public PacketDecoder visitHumanReadable(HumanReadableFormat format) {
                return new HumanReadableDecoder(format, sequencer, sink);
            }

            @Override
            public PacketDecoder visitCompressedCsv(CompressedCsvFormat format) {
                return new CompressedCsvDecoder(format, sequencer, sink);
            }

            @Override
            public PacketDecoder visitEncodedChars(EncodedCharsFormat format) {
                return new EncodedCharsDecoder(format, sequencer, sink);
            }

            @Override
            public PacketDecoder visitEncodedBits(EncodedBitsFormat format) {
                return new EncodedBitsDecoder(format, sequencer, sink);
            }
        });
    }
}
