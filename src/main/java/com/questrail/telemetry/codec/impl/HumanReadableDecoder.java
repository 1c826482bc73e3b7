package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.codec.DelimitedSplitter;
import com.questrail.telemetry.codec.DelimiterMatch;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.FormatType;
import com.questrail.telemetry.config.HumanReadableFormat;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * Type 0 decoder: human readable text.
 *
 * <p>For each fragment:</p>
 * <ol>
 *   <li>split once on the first occurring data delimiter into id and data
 *       (no delimiter: the whole fragment is the id, data is empty)</li>
 *   <li>drop the fragment unless the id exactly equals a configured packet id</li>
 *   <li>remove every ignore string from the data, in configured order</li>
 * </ol>
 *
 * No state is carried between fragments.
 */
public final class HumanReadableDecoder extends AbstractPacketDecoder<String>
{
    private final HumanReadableFormat format;
    private final DelimitedSplitter splitter;

    public HumanReadableDecoder(HumanReadableFormat format,
                                PacketSequencer sequencer,
                                DecodeObservabilitySink sink) {
        super(sequencer, sink);
        this.format = Objects.requireNonNull(format, "format");
        this.splitter = new DelimitedSplitter(format.packetDelimiters());
    }

    @Override
    public void append(byte[] chunk) {
        splitter.append(chunk);
    }

    @Override
    protected FormatType format() {
        return FormatType.HUMAN_READABLE;
    }

    @Override
    protected Optional<String> nextUnit() {
        return splitter.next();
    }

    @Override
    protected Optional<ParsedPacket> decodeUnit(String fragment) {
        String id = fragment;
        String data = "";

        Optional<DelimiterMatch> match = DelimiterMatch.find(fragment, format.dataDelimiters());
        if (match.isPresent()) {
            id = match.get().head(fragment);
            data = match.get().tail(fragment);
        }

        if (!format.packetIds().contains(id)) {
            throw new DecodeResyncException("unknown packet id \"" + id + "\"");
        }

        for (String ignored : format.ignore()) {
            data = data.replace(ignored, "");
        }
        return Optional.of(sequencer.emit(id, PacketValue.of(data)));
    }

    @Override
    public void reset() {
        splitter.reset();
    }

    @Override
    public void close() {
        splitter.close();
    }
}
