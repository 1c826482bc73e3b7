package com.questrail.telemetry.codec;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A fixed-length run of bits cut from the stream by {@link FixedLengthChunker}.
 *
 * <p>The bits are held as an unsigned integer, most-significant bit first:
 * bit offset 0 is the first bit received.</p>
 *
 * @param bits      unsigned frame content
 * @param bitLength number of bits in the frame
 */
public record BitFrame(BigInteger bits, int bitLength)
{
    public BitFrame {
        Objects.requireNonNull(bits, "bits");
        if (bitLength < 1) {
            throw new IllegalArgumentException("bitLength must be >= 1");
        }
        if (bits.signum() < 0 || bits.bitLength() > bitLength) {
            throw new IllegalArgumentException("bits do not fit in " + bitLength + " bits");
        }
    }

    /**
     * Extracts {@code width} bits starting {@code offset} bits from the start
     * of the frame, as an unsigned integer.
     */
    public BigInteger field(int offset, int width) {
        if (offset < 0 || width < 1 || offset + width > bitLength) {
            throw new IndexOutOfBoundsException(
                    "field [" + offset + ", " + (offset + width) + ") outside frame of " + bitLength + " bits");
        }
        int shift = bitLength - offset - width;
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return bits.shiftRight(shift).and(mask);
    }

    /**
     * Printable rendering for diagnostics.
     */
    public String toHexString() {
        return "0x" + bits.toString(16) + "/" + bitLength + "b";
    }
}
