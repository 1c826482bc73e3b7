package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.codec.DelimitedSplitter;
import com.questrail.telemetry.codec.DelimiterMatch;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.CompressedCsvFormat;
import com.questrail.telemetry.config.FormatType;
import com.questrail.telemetry.observability.DecodeObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * Type 1 decoder: compressed CSV token pairs.
 *
 * <h2>Pairing rules</h2>
 * Each token is split on its first data delimiter into specifier and value.
 * <ul>
 *   <li>id token: its value becomes the pending id, replacing (and dropping)
 *       any id already pending</li>
 *   <li>data token with a pending id: emits {@code (pendingId, value)} and
 *       clears the slot</li>
 *   <li>data token without a pending id: dropped</li>
 *   <li>token without a data delimiter, or with an unknown specifier: dropped;
 *       the pending slot is left as is</li>
 * </ul>
 * Packets whose id is not a configured packet id are dropped after pairing.
 *
 * <p>At most one pending id is ever held, so a desynchronized stream cannot
 * grow decoder state.</p>
 */
public final class CompressedCsvDecoder extends AbstractPacketDecoder<String>
{
    private final CompressedCsvFormat format;
    private final DelimitedSplitter splitter;

    // PendingPairState: owned by this decoder's single consumer.
    private String pendingId;

    public CompressedCsvDecoder(CompressedCsvFormat format,
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

    /**
     * The id waiting for its data token, if any.
     */
    public Optional<String> pendingId() {
        return Optional.ofNullable(pendingId);
    }

    @Override
    protected FormatType format() {
        return FormatType.COMPRESSED_CSV;
    }

    @Override
    protected Optional<String> nextUnit() {
        return splitter.next();
    }

    @Override
    protected Optional<ParsedPacket> decodeUnit(String token) {
        DelimiterMatch match = DelimiterMatch.find(token, format.dataDelimiters())
                .orElseThrow(() -> new DecodeResyncException("token has no data delimiter"));

        final String specifier = match.head(token);
        final String value = match.tail(token);

        if (specifier.equals(format.idSpecifier())) {
            if (pendingId != null) {
                reportResync("pending id superseded before its data token", pendingId);
            }
            pendingId = value;
            return Optional.empty();
        }

        if (specifier.equals(format.dataSpecifier())) {
            if (pendingId == null) {
                throw new DecodeResyncException("data token without a pending id");
            }
            final String id = pendingId;
            pendingId = null;

            if (!format.packetIds().contains(id)) {
                throw new DecodeResyncException("unknown packet id \"" + id + "\"");
            }
            return Optional.of(sequencer.emit(id, PacketValue.of(value)));
        }

        throw new DecodeResyncException("unknown specifier \"" + specifier + "\"");
    }

    @Override
    public void reset() {
        splitter.reset();
        pendingId = null;
    }

    @Override
    public void close() {
        splitter.close();
    }
}
