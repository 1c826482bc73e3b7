package com.questrail.telemetry.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FrameLayout
 * -----------------------------------------------------------------------------
 * Bit-level geometry of a fixed-length binary frame (types 2 and 3).
 *
 * <p>All widths are in bits. A frame whose total width is not a multiple of 8
 * occupies the next whole number of bytes on the wire; the extra bits are zero
 * padding at the most-significant end, ahead of the first field.</p>
 *
 * <pre>
 *   | pad | field 0 | field 1 | ... |   (MSB first)
 * </pre>
 */
public record FrameLayout(List<HeaderField> order, List<Integer> widthsBits)
{
    /** Largest supported frame: 64 KiB on the wire. */
    public static final int MAX_FRAME_BITS = 65_536 * 8;

    public FrameLayout {
        order = List.copyOf(Objects.requireNonNull(order, "order"));
        widthsBits = List.copyOf(Objects.requireNonNull(widthsBits, "widthsBits"));
        if (order.size() != widthsBits.size()) {
            throw new IllegalArgumentException("order and widthsBits must have equal length");
        }
        long total = 0;
        for (int w : widthsBits) {
            if (w < 1) {
                throw new IllegalArgumentException("field widths must be >= 1");
            }
            total += w;
        }
        if (total > MAX_FRAME_BITS) {
            throw new IllegalArgumentException("frame of " + total + " bits exceeds " + MAX_FRAME_BITS + " bits");
        }
        if (order.indexOf(HeaderField.ID) < 0 || order.indexOf(HeaderField.DATA) < 0) {
            throw new IllegalArgumentException("layout requires an ID and a DATA field");
        }
    }

    /**
     * Builds a layout from byte-sized field lengths.
     */
    public static FrameLayout ofBytes(List<HeaderField> order, List<Integer> lengthsBytes) {
        List<Integer> bits = new ArrayList<>(lengthsBytes.size());
        for (int len : lengthsBytes) {
            bits.add(Math.multiplyExact(len, 8));
        }
        return new FrameLayout(order, bits);
    }

    public int fieldCount() {
        return order.size();
    }

    /** Sum of all field widths, excluding padding. */
    public int totalBits() {
        int total = 0;
        for (int w : widthsBits) {
            total += w;
        }
        return total;
    }

    /** Number of bytes one frame occupies on the wire. */
    public int frameBytes() {
        return (totalBits() + 7) / 8;
    }

    /** Frame width rounded up to the next byte boundary. */
    public int paddedBits() {
        return frameBytes() * 8;
    }

    public int paddingBits() {
        return paddedBits() - totalBits();
    }

    /**
     * Bit offset of field {@code index}, counted from the most-significant bit
     * of the padded frame.
     */
    public int offsetBits(int index) {
        int offset = paddingBits();
        for (int i = 0; i < index; i++) {
            offset += widthsBits.get(i);
        }
        return offset;
    }

    public int indexOf(HeaderField field) {
        return order.indexOf(field);
    }

    /** Number of hex digits used when rendering field {@code index}. */
    public int hexDigits(int index) {
        return (widthsBits.get(index) + 3) / 4;
    }
}
