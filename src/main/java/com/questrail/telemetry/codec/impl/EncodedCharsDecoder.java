package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.EncodedCharsFormat;
import com.questrail.telemetry.config.FormatType;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

/**
 * Type 2 decoder: frames of {@code sum(header_len)} bytes, fields read as
 * unsigned big-endian integers.
 */
public final class EncodedCharsDecoder extends AbstractFrameDecoder
{
    public EncodedCharsDecoder(EncodedCharsFormat format,
                               PacketSequencer sequencer,
                               DecodeObservabilitySink sink) {
        super(format.layout(), format.packetIds(), sequencer, sink);
    }

    @Override
    protected FormatType format() {
        return FormatType.ENCODED_CHARS;
    }
}
