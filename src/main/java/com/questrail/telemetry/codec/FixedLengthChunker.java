package com.questrail.telemetry.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * FixedLengthChunker
 * -----------------------------------------------------------------------------
 * Cuts a byte stream into frames of a fixed number of bits.
 *
 * <p>The stream is viewed as a contiguous bit sequence, most-significant bit of
 * each byte first. Frames need not be byte aligned: a 12-bit frame length
 * consumes one and a half bytes per frame. Bits shorter than one full frame
 * remain in the frame buffer until more bytes arrive.</p>
 *
 * <h2>Netty containment rule</h2>
 * The {@link ByteBuf} frame buffer never escapes this class.
 *
 * <p>Not thread-safe; owned by the single consumer of one connection.</p>
 */
public final class FixedLengthChunker implements AutoCloseable
{
    private final int frameBits;
    private final ByteBuf buffer = Unpooled.buffer();

    // Bits of the first readable byte already consumed by the previous frame (0..7).
    private int bitOffset;

    public FixedLengthChunker(int frameBits) {
        if (frameBits < 1) {
            throw new IllegalArgumentException("frameBits must be >= 1");
        }
        this.frameBits = frameBits;
    }

    public static FixedLengthChunker ofBytes(int frameBytes) {
        return new FixedLengthChunker(frameBytes * 8);
    }

    public int frameBits() {
        return frameBits;
    }

    public void append(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        buffer.writeBytes(chunk);
    }

    /**
     * Returns the next complete frame, or {@link Optional#empty()} if fewer
     * than {@link #frameBits()} bits are buffered.
     */
    public Optional<BitFrame> next() {
        if (bufferedBits() < frameBits) {
            return Optional.empty();
        }

        final int spanBits = bitOffset + frameBits;
        final int spanBytes = (spanBits + 7) / 8;

        byte[] raw = new byte[spanBytes];
        buffer.getBytes(buffer.readerIndex(), raw);

        int trailing = spanBytes * 8 - spanBits;
        BigInteger mask = BigInteger.ONE.shiftLeft(frameBits).subtract(BigInteger.ONE);
        BigInteger bits = new BigInteger(1, raw).shiftRight(trailing).and(mask);

        buffer.skipBytes(spanBits / 8);
        bitOffset = spanBits % 8;
        buffer.discardSomeReadBytes();

        return Optional.of(new BitFrame(bits, frameBits));
    }

    /**
     * Number of buffered bits not yet emitted as a frame.
     */
    public long bufferedBits() {
        return (long) buffer.readableBytes() * 8 - bitOffset;
    }

    public void reset() {
        buffer.clear();
        bitOffset = 0;
    }

    @Override
    public void close() {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
    }
}
