package com.questrail.telemetry.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DelimitedSplitter
 * -----------------------------------------------------------------------------
 * Splits an arriving byte stream into text fragments on a set of delimiter
 * strings.
 *
 * <h2>Matching rule</h2>
 * The earliest delimiter occurrence in the buffered bytes ends the fragment.
 * When several delimiters match at that same position, the longest wins, so a
 * stream split on {@code "\r\n"} and {@code "\n"} never leaves a stray
 * {@code '\r'} behind.
 *
 * <h2>Buffering</h2>
 * Bytes after the last delimiter are held until more input arrives;
 * {@link #next()} returns {@link Optional#empty()} ("need more data") rather
 * than failing. Bytes already scanned are not scanned again, so a long
 * undelimited run costs linear time. Matching is done on UTF-8 bytes, so a
 * multi-byte character split across two chunks is never decoded half-way.
 *
 * <h2>Netty containment rule</h2>
 * The {@link ByteBuf} accumulator never escapes this class.
 *
 * <p>Not thread-safe; owned by the single consumer of one connection.</p>
 */
public final class DelimitedSplitter implements AutoCloseable
{
    private final List<byte[]> delimiters;
    private final int longestDelimiter;
    private final ByteBuf buffer = Unpooled.buffer();

    // Leading readable bytes already known not to start a delimiter.
    private int scannedBytes;

    public DelimitedSplitter(List<String> delimiters) {
        Objects.requireNonNull(delimiters, "delimiters");
        if (delimiters.isEmpty()) {
            throw new IllegalArgumentException("At least one delimiter required");
        }
        List<byte[]> encoded = new ArrayList<>(delimiters.size());
        for (String d : delimiters) {
            if (d.isEmpty()) {
                throw new IllegalArgumentException("Delimiters must not be empty");
            }
            encoded.add(d.getBytes(StandardCharsets.UTF_8));
        }
        // Longest first: the first hit at a position is the longest one.
        encoded.sort(Comparator.comparingInt((byte[] b) -> b.length).reversed());
        this.delimiters = List.copyOf(encoded);
        this.longestDelimiter = encoded.get(0).length;
    }

    /**
     * Appends a chunk of stream bytes.
     */
    public void append(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        buffer.writeBytes(chunk);
    }

    /**
     * Returns the next complete fragment with its delimiter stripped, or
     * {@link Optional#empty()} if no delimiter has arrived yet.
     */
    public Optional<String> next() {
        final int start = buffer.readerIndex();
        final int end = buffer.writerIndex();

        for (int i = start + scannedBytes; i < end; i++) {
            byte[] match = matchAt(i, end);
            if (match != null) {
                String fragment = buffer.toString(start, i - start, StandardCharsets.UTF_8);
                buffer.readerIndex(i + match.length);
                buffer.discardSomeReadBytes();
                scannedBytes = 0;
                return Optional.of(fragment);
            }
        }
        // The tail may still hold the start of a delimiter whose remaining bytes have not arrived.
        scannedBytes = Math.max(scannedBytes, end - start - (longestDelimiter - 1));
        return Optional.empty();
    }

    /**
     * Number of buffered bytes not yet emitted as a fragment.
     */
    public int bufferedBytes() {
        return buffer.readableBytes();
    }

    /**
     * Discards all buffered bytes.
     */
    public void reset() {
        buffer.clear();
        scannedBytes = 0;
    }

    @Override
    public void close() {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
    }

    private byte[] matchAt(int index, int end) {
        for (byte[] d : delimiters) {
            if (index + d.length > end) {
                continue;
            }
            boolean hit = true;
            for (int k = 0; k < d.length; k++) {
                if (buffer.getByte(index + k) != d[k]) {
                    hit = false;
                    break;
                }
            }
            if (hit) {
                return d;
            }
        }
        return null;
    }
}
