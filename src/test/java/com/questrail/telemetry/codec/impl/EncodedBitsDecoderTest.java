package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.NumericValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.config.EncodedBitsFormat;
import com.questrail.telemetry.config.FormatDescriptorParser;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EncodedBitsDecoderTest
{
    // ---------------------------------------------------------------------
    // Padding
    // ---------------------------------------------------------------------

    /**
     * Twelve header bits are padded to two bytes at the front:
     * {@code 0000 0001 1000 1010} is id 0x1, data 0x8a.
     */
    @Test
    void frameIsLeftPaddedToAByteBoundary() throws Exception {
        try (EncodedBitsDecoder decoder = decoder(4, 8, "0x1")) {
            decoder.append(new byte[] {0x01, (byte) 0x8A, 0x01, (byte) 0xFF});

            ParsedPacket first = decoder.poll().orElseThrow();
            ParsedPacket second = decoder.poll().orElseThrow();
            assertEquals("0x1", first.id());
            assertEquals(NumericValue.of(0x8A), first.value());
            assertEquals(NumericValue.of(0xFF), second.value());
            assertEquals(Optional.empty(), decoder.poll());
        }
    }

    @Test
    void paddingBitsAreIgnored() throws Exception {
        try (EncodedBitsDecoder decoder = decoder(4, 8, "0x1")) {
            decoder.append(new byte[] {(byte) 0xF1, (byte) 0x8A});

            assertEquals(NumericValue.of(0x8A), decoder.poll().orElseThrow().value());
        }
    }

    @Test
    void fullWidthFieldsNeedNoPadding() throws Exception {
        try (EncodedBitsDecoder decoder = decoder(3, 5, "0x5")) {
            decoder.append(new byte[] {(byte) 0b1011_0110});

            ParsedPacket packet = decoder.poll().orElseThrow();
            assertEquals("0x5", packet.id());
            assertEquals(NumericValue.of(0b10110), packet.value());
        }
    }

    // ---------------------------------------------------------------------
    // Round trip through the reference encoder
    // ---------------------------------------------------------------------

    @Test
    void decodingEncodedFramesRoundTripsFieldValues() throws Exception {
        int[][] layouts = {{3, 5}, {5, 7}, {1, 64}, {12, 4}, {9, 23}, {16, 16}};
        Random random = new Random(73);

        for (int[] widths : layouts) {
            int idBits = widths[0];
            int dataBits = widths[1];
            BigInteger id = BigInteger.ONE.shiftLeft(idBits).subtract(BigInteger.ONE);
            String hexId = new NumericValue(id).toHex((idBits + 3) / 4);

            try (EncodedBitsDecoder decoder = decoder(idBits, dataBits, hexId)) {
                EncodedBitsFormat format = format(idBits, dataBits, hexId);
                FixedFrameEncoder encoder = FixedFrameEncoder.forFormat(format);

                List<BigInteger> expected = new ArrayList<>();
                ByteArrayOutputStream stream = new ByteArrayOutputStream();
                for (int i = 0; i < 20; i++) {
                    BigInteger data = new BigInteger(dataBits, random);
                    expected.add(data);
                    stream.writeBytes(encoder.encode(id, data));
                }
                // a frame with a foreign id in the middle is dropped
                stream.writeBytes(encoder.encode(BigInteger.ZERO, BigInteger.ONE));

                decoder.append(stream.toByteArray());
                List<BigInteger> decoded = new ArrayList<>();
                for (Optional<ParsedPacket> p = decoder.poll(); p.isPresent(); p = decoder.poll()) {
                    assertEquals(hexId, p.get().id());
                    decoded.add(((NumericValue) p.get().value()).value());
                }
                assertEquals(expected, decoded, "layout " + idBits + "/" + dataBits);
            }
        }
    }

    @Test
    void encoderRejectsValuesWiderThanTheirField() throws Exception {
        FixedFrameEncoder encoder = FixedFrameEncoder.forFormat(format(4, 8, "0x1"));

        assertThrows(IllegalArgumentException.class, () -> encoder.encode(16, 1));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, 256));
        assertArrayEquals(new byte[] {0x01, (byte) 0x8A}, encoder.encode(1, 0x8A));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static EncodedBitsFormat format(int idBits, int dataBits, String id) throws Exception {
        return (EncodedBitsFormat) new FormatDescriptorParser().parse(
                "{\"type\": 3, \"header_order\": [\"ID\", \"DATA\"], \"header_len\": [" + idBits + ", " + dataBits
                        + "], \"packet_ids\": [\"" + id + "\"]}");
    }

    private static EncodedBitsDecoder decoder(int idBits, int dataBits, String id) throws Exception {
        return new EncodedBitsDecoder(format(idBits, dataBits, id),
                new PacketSequencer(new ManualMonotonicClock()),
                NullObservabilitySink.INSTANCE);
    }
}
