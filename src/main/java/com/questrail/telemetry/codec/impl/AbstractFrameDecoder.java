package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.NumericValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.codec.BitFrame;
import com.questrail.telemetry.codec.FixedLengthChunker;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.FrameLayout;
import com.questrail.telemetry.config.HeaderField;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Common frame handling for the binary formats (types 2 and 3).
 *
 * <p>Each complete frame is sliced into fields per the {@link FrameLayout}.
 * The ID field is rendered as zero-padded lowercase hex ({@code 0x432000}) and
 * must equal a configured packet id; otherwise the whole frame is dropped.
 * The DATA field becomes the packet value.</p>
 *
 * <p>Leftover bytes shorter than one frame stay in the frame buffer; they are
 * never an error.</p>
 */
abstract class AbstractFrameDecoder extends AbstractPacketDecoder<BitFrame>
{
    private final FrameLayout layout;
    private final Set<String> packetIds;
    private final FixedLengthChunker chunker;

    private final int idIndex;
    private final int dataIndex;

    AbstractFrameDecoder(FrameLayout layout,
                         Set<String> packetIds,
                         PacketSequencer sequencer,
                         DecodeObservabilitySink sink) {
        super(sequencer, sink);
        this.layout = Objects.requireNonNull(layout, "layout");
        this.packetIds = Objects.requireNonNull(packetIds, "packetIds");
        this.chunker = new FixedLengthChunker(layout.paddedBits());
        this.idIndex = layout.indexOf(HeaderField.ID);
        this.dataIndex = layout.indexOf(HeaderField.DATA);
    }

    @Override
    public final void append(byte[] chunk) {
        chunker.append(chunk);
    }

    @Override
    protected final Optional<BitFrame> nextUnit() {
        return chunker.next();
    }

    @Override
    protected final Optional<ParsedPacket> decodeUnit(BitFrame frame) {
        NumericValue idValue = new NumericValue(field(frame, idIndex));
        String id = idValue.toHex(layout.hexDigits(idIndex));

        if (!packetIds.contains(id)) {
            throw new DecodeResyncException("unknown packet id " + id);
        }
        return Optional.of(sequencer.emit(id, new NumericValue(field(frame, dataIndex))));
    }

    @Override
    protected final String describe(BitFrame frame) {
        return frame.toHexString();
    }

    /**
     * Bits still waiting for a complete frame.
     */
    public final long bufferedBits() {
        return chunker.bufferedBits();
    }

    @Override
    public final void reset() {
        chunker.reset();
    }

    @Override
    public final void close() {
        chunker.close();
    }

    private BigInteger field(BitFrame frame, int index) {
        return frame.field(layout.offsetBits(index), layout.widthsBits().get(index));
    }
}
