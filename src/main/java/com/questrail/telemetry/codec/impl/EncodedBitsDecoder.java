package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.EncodedBitsFormat;
import com.questrail.telemetry.config.FormatType;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

/**
 * Type 3 decoder: bit-packed frames.
 *
 * <p>A frame of {@code sum(header_len)} bits occupies the next whole number of
 * bytes; the padding bits sit at the most-significant end and are skipped, so
 * field boundaries follow the unpadded widths shifted by the padding.</p>
 *
 * <pre>
 *   header_len = [4, 8]  →  2 bytes per frame
 *   0000 IIII DDDDDDDD
 *   pad  ID   DATA
 * </pre>
 */
public final class EncodedBitsDecoder extends AbstractFrameDecoder
{
    public EncodedBitsDecoder(EncodedBitsFormat format,
                              PacketSequencer sequencer,
                              DecodeObservabilitySink sink) {
        super(format.layout(), format.packetIds(), sequencer, sink);
    }

    @Override
    protected FormatType format() {
        return FormatType.ENCODED_BITS;
    }
}
