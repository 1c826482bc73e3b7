package com.questrail.telemetry.api;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer payload.
 *
 * <p>Binary frames carry unsigned fields of arbitrary width (an 8-byte DATA
 * field is common), so the value is held as a {@link BigInteger}. Frame fields
 * are never negative; time and index x-coordinates use the same type.</p>
 */
public record NumericValue(BigInteger value) implements PacketValue
{
    public NumericValue {
        Objects.requireNonNull(value, "value");
    }

    public static NumericValue of(long value) {
        return new NumericValue(BigInteger.valueOf(value));
    }

    /**
     * Renders the value as {@code 0x}-prefixed lowercase hex, zero-padded to
     * {@code digits} hex digits.
     */
    public String toHex(int digits) {
        String hex = value.toString(16);
        StringBuilder sb = new StringBuilder(2 + Math.max(digits, hex.length()));
        sb.append("0x");
        for (int i = hex.length(); i < digits; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }

    @Override
    public String render() {
        return value.toString();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
