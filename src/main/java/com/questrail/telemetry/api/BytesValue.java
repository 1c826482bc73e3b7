package com.questrail.telemetry.api;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Raw byte-sequence payload.
 *
 * The bytes are copied on construction and on access.
 */
public final class BytesValue implements PacketValue
{
    private final byte[] bytes;

    public BytesValue(byte[] bytes) {
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public String render() {
        return "0x" + HexFormat.of().formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BytesValue other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return render();
    }
}
