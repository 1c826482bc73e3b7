package com.questrail.telemetry.codec;

import com.questrail.telemetry.api.ParsedPacket;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * PacketDecoder
 * -----------------------------------------------------------------------------
 * Stream-level decoder for one packet format.
 *
 * <p>A decoder owns all cross-chunk state for one connection: the splitter or
 * frame buffer, and for type 1 the pending id. It is fed chunks with
 * {@link #append(byte[])} and drained with {@link #poll()}, one packet at a
 * time, so the caller can stop between any two packets.</p>
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Cutting the stream into fragments or frames</li>
 *   <li>Applying its format's matching and pairing rules</li>
 *   <li>Dropping units that fail those rules and carrying on with the next</li>
 * </ul>
 *
 * <p>It is <strong>not</strong> responsible for filtering or series routing.</p>
 *
 * <p>Implementations are not thread-safe.</p>
 */
public interface PacketDecoder extends AutoCloseable
{
    /**
     * Buffers a chunk of stream bytes. Never decodes and never fails on
     * content.
     */
    void append(byte[] chunk);

    /**
     * Decodes buffered input until one packet is produced.
     *
     * @return the next packet, or {@link Optional#empty()} when the buffered
     *         input holds no further complete packet ("need more data")
     */
    Optional<ParsedPacket> poll();

    /**
     * As {@link #poll()}, but checks {@code stop} before every fragment or
     * frame, including those that are dropped, and returns empty as soon as
     * it reports {@code true}.
     */
    Optional<ParsedPacket> poll(BooleanSupplier stop);

    /**
     * Discards all buffered input and cross-packet state.
     */
    void reset();

    @Override
    void close();
}
