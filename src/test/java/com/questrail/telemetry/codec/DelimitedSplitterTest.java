package com.questrail.telemetry.codec;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DelimitedSplitterTest
{
    private DelimitedSplitter splitter;

    @AfterEach
    void release() {
        if (splitter != null) {
            splitter.close();
        }
    }

    @Test
    void emitsFragmentsAndHoldsTheRemainder() {
        splitter = new DelimitedSplitter(List.of("\n"));
        splitter.append(bytes("a\nb\nc"));

        assertEquals(Optional.of("a"), splitter.next());
        assertEquals(Optional.of("b"), splitter.next());
        assertEquals(Optional.empty(), splitter.next(), "need more data");
        assertEquals(1, splitter.bufferedBytes());

        splitter.append(bytes("d\n"));
        assertEquals(Optional.of("cd"), splitter.next());
        assertEquals(0, splitter.bufferedBytes());
    }

    /**
     * "\r\n" and "\n" both match at the same position: the longer one must
     * win so no stray carriage return is left on the next fragment.
     */
    @Test
    void longestDelimiterWinsAtTheSamePosition() {
        splitter = new DelimitedSplitter(List.of("\n", "\r\n"));
        splitter.append(bytes("one\r\ntwo\nthree\r\n"));

        assertEquals(List.of("one", "two", "three"), drain());
    }

    @Test
    void earliestDelimiterWinsOverLongerLaterOne() {
        splitter = new DelimitedSplitter(List.of(";;", ","));
        splitter.append(bytes("a,b;;c,"));

        assertEquals(List.of("a", "b", "c"), drain());
    }

    @Test
    void delimiterSplitAcrossChunksIsRecognised() {
        splitter = new DelimitedSplitter(List.of("\r\n"));
        splitter.append(bytes("x\r"));
        assertEquals(Optional.empty(), splitter.next());

        splitter.append(bytes("\ny\r\n"));
        assertEquals(List.of("x", "y"), drain());
    }

    @Test
    void multiByteCharacterSplitAcrossChunksIsDecodedWhole() {
        splitter = new DelimitedSplitter(List.of("\n"));
        byte[] encoded = bytes("temp=21°C\n");
        int cut = 8; // inside the two-byte degree sign

        splitter.append(Arrays.copyOfRange(encoded, 0, cut));
        assertEquals(Optional.empty(), splitter.next());
        splitter.append(Arrays.copyOfRange(encoded, cut, encoded.length));

        assertEquals(Optional.of("temp=21°C"), splitter.next());
    }

    @Test
    void consecutiveDelimitersYieldEmptyFragments() {
        splitter = new DelimitedSplitter(List.of(";"));
        splitter.append(bytes(";;a;"));

        assertEquals(List.of("", "", "a"), drain());
    }

    /**
     * A long run without any delimiter, fed one byte at a time, must not be
     * rescanned from the start on every call.
     */
    @Test
    void longUndelimitedRunIsScannedOnce() {
        splitter = new DelimitedSplitter(List.of("\r\n", "\n"));
        byte[] one = {'x'};

        assertTimeout(Duration.ofSeconds(5), () -> {
            for (int i = 0; i < 200_000; i++) {
                splitter.append(one);
                assertEquals(Optional.empty(), splitter.next());
            }
        });

        splitter.append(bytes("\r\n"));
        String fragment = splitter.next().orElseThrow();
        assertEquals(200_000, fragment.length());
        assertEquals(0, splitter.bufferedBytes());
    }

    @Test
    void multiByteDelimiterArrivingByteByByteIsFound() {
        splitter = new DelimitedSplitter(List.of("<|>"));
        for (byte b : bytes("abc<|>def<|")) {
            splitter.append(new byte[] {b});
            splitter.next().ifPresent(f -> assertEquals("abc", f));
        }
        assertEquals(5, splitter.bufferedBytes());

        splitter.append(bytes(">"));
        assertEquals(Optional.of("def"), splitter.next());
    }

    @Test
    void resetDiscardsBufferedBytes() {
        splitter = new DelimitedSplitter(List.of("\n"));
        splitter.append(bytes("partial"));
        splitter.reset();
        splitter.append(bytes("fresh\n"));

        assertEquals(Optional.of("fresh"), splitter.next());
    }

    @Test
    void rejectsEmptyDelimiterSets() {
        assertThrows(IllegalArgumentException.class, () -> new DelimitedSplitter(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new DelimitedSplitter(List.of("")));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private List<String> drain() {
        List<String> out = new ArrayList<>();
        for (Optional<String> f = splitter.next(); f.isPresent(); f = splitter.next()) {
            out.add(f.get());
        }
        return out;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
