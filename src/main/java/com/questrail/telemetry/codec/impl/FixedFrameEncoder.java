package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.config.EncodedBitsFormat;
import com.questrail.telemetry.config.EncodedCharsFormat;
import com.questrail.telemetry.config.FrameLayout;
import com.questrail.telemetry.config.HeaderField;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference encoder for the binary formats.
 *
 * <p>Packs field values into a frame exactly as {@link EncodedCharsDecoder} and
 * {@link EncodedBitsDecoder} read them: fields in header order, most-significant
 * bit first, zero padding at the front up to a byte boundary. Used to simulate
 * instruments.</p>
 */
public final class FixedFrameEncoder
{
    private final FrameLayout layout;

    public FixedFrameEncoder(FrameLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public static FixedFrameEncoder forFormat(EncodedCharsFormat format) {
        return new FixedFrameEncoder(format.layout());
    }

    public static FixedFrameEncoder forFormat(EncodedBitsFormat format) {
        return new FixedFrameEncoder(format.layout());
    }

    /**
     * Encodes a frame from its ID and DATA values.
     */
    public byte[] encode(BigInteger id, BigInteger data) {
        List<BigInteger> fields = new ArrayList<>(layout.fieldCount());
        for (HeaderField f : layout.order()) {
            fields.add(f == HeaderField.ID ? id : data);
        }
        return encode(fields);
    }

    public byte[] encode(long id, long data) {
        return encode(BigInteger.valueOf(id), BigInteger.valueOf(data));
    }

    /**
     * Encodes a frame from field values given in header order.
     *
     * @throws IllegalArgumentException if a value is negative or wider than its field
     */
    public byte[] encode(List<BigInteger> fields) {
        Objects.requireNonNull(fields, "fields");
        if (fields.size() != layout.fieldCount()) {
            throw new IllegalArgumentException(
                    "expected " + layout.fieldCount() + " field values, got " + fields.size());
        }

        BigInteger frame = BigInteger.ZERO;
        for (int i = 0; i < fields.size(); i++) {
            BigInteger value = Objects.requireNonNull(fields.get(i), "field value");
            int width = layout.widthsBits().get(i);
            if (value.signum() < 0 || value.bitLength() > width) {
                throw new IllegalArgumentException(
                        "value " + value + " does not fit field " + i + " of " + width + " bits");
            }
            frame = frame.shiftLeft(width).or(value);
        }

        byte[] magnitude = frame.toByteArray();
        byte[] out = new byte[layout.frameBytes()];
        // toByteArray may carry a leading sign byte or be shorter than the frame.
        int copy = Math.min(magnitude.length, out.length);
        System.arraycopy(magnitude, magnitude.length - copy, out, out.length - copy, copy);
        return out;
    }
}
