package com.questrail.telemetry.config;

/**
 * The four supported wire encodings, keyed by the {@code type} code used in
 * packet configuration documents.
 */
public enum FormatType
{
    /** Delimited human readable text, e.g. {@code "motor speed: 200 rpm\n"}. */
    HUMAN_READABLE(0),

    /** Delimited specifier/value token pairs, e.g. {@code "id:temp;data:128;"}. */
    COMPRESSED_CSV(1),

    /** Fixed-length binary frames with byte-sized fields. */
    ENCODED_CHARS(2),

    /** Fixed-length binary frames with bit-sized fields. */
    ENCODED_BITS(3);

    private final int code;

    FormatType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not 0-3
     */
    public static FormatType fromCode(int code) {
        for (FormatType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown packet format type: " + code);
    }
}
