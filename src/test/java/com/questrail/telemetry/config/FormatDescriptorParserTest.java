package com.questrail.telemetry.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormatDescriptorParserTest
{
    private final FormatDescriptorParser parser = new FormatDescriptorParser();

    // ---------------------------------------------------------------------
    // Happy path, one per type
    // ---------------------------------------------------------------------

    @Test
    void parsesHumanReadableFormat() throws ConfigError {
        FormatDescriptor d = parser.parse("""
                {
                  "type": 0,
                  "packet_delimiters": ["\\n", "\\t"],
                  "packet_ids": ["output"],
                  "data_delimiters": ["="],
                  "ignore": ["\\r", " "]
                }
                """);

        HumanReadableFormat f = assertInstanceOf(HumanReadableFormat.class, d);
        assertEquals(FormatType.HUMAN_READABLE, f.type());
        assertEquals(List.of("\n", "\t"), f.packetDelimiters());
        assertEquals(Set.of("output"), f.packetIds());
        assertEquals(List.of("="), f.dataDelimiters());
        assertEquals(List.of("\r", " "), f.ignore());
        assertTrue(f.graphDefinitions().isEmpty());
    }

    @Test
    void humanReadableOptionalFieldsDefaultToEmpty() throws ConfigError {
        HumanReadableFormat f = (HumanReadableFormat) parser.parse("""
                {"type": 0, "packet_delimiters": [";"], "packet_ids": ["a"]}
                """);
        assertTrue(f.dataDelimiters().isEmpty());
        assertTrue(f.ignore().isEmpty());
    }

    @Test
    void parsesCompressedCsvFormat() throws ConfigError {
        CompressedCsvFormat f = (CompressedCsvFormat) parser.parse("""
                {
                  "type": 1,
                  "packet_delimiters": [";"],
                  "packet_ids": ["0x632", "0x45"],
                  "data_delimiters": [":"],
                  "specifiers": ["id", "data"]
                }
                """);
        assertEquals("id", f.idSpecifier());
        assertEquals("data", f.dataSpecifier());
        assertEquals(List.of(":"), f.dataDelimiters());
    }

    @Test
    void compressedCsvWithoutDataDelimitersUsesColon() throws ConfigError {
        CompressedCsvFormat f = (CompressedCsvFormat) parser.parse("""
                {"type": 1, "packet_delimiters": [";"], "packet_ids": ["t"], "specifiers": ["id", "data"]}
                """);
        assertEquals(CompressedCsvFormat.DEFAULT_DATA_DELIMITERS, f.dataDelimiters());
    }

    @Test
    void parsesEncodedCharsFormat() throws ConfigError {
        EncodedCharsFormat f = (EncodedCharsFormat) parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [3, 8], "packet_ids": ["0x432000"]}
                """);
        assertEquals(List.of(HeaderField.ID, HeaderField.DATA), f.headerOrder());
        assertEquals(11, f.frameLength());
        assertEquals(88, f.layout().totalBits());
        assertEquals(0, f.layout().paddingBits());
    }

    @Test
    void parsesEncodedBitsFormat() throws ConfigError {
        EncodedBitsFormat f = (EncodedBitsFormat) parser.parse("""
                {"type": 3, "header_order": ["ID", "DATA"], "header_len": [4, 8], "packet_ids": ["0x1"]}
                """);
        FrameLayout layout = f.layout();
        assertEquals(12, layout.totalBits());
        assertEquals(16, layout.paddedBits());
        assertEquals(4, layout.paddingBits());
        assertEquals(4, layout.offsetBits(0));
        assertEquals(8, layout.offsetBits(1));
    }

    @Test
    void acceptsFullConfigurationDocument() throws ConfigError {
        PacketConfiguration c = parser.parseConfiguration("""
                {
                  "packet_title": "Type 0 Example",
                  "packet_description": "Arduino AnalogInOutSerial output.",
                  "example_line": "sensor = <VAL>\\toutput = <VAL>\\n",
                  "packet_format": {
                    "type": 0,
                    "packet_delimiters": ["\\n"],
                    "packet_ids": ["output"]
                  }
                }
                """);
        assertEquals("Type 0 Example", c.title());
        assertEquals("Arduino AnalogInOutSerial output.", c.description());
        assertEquals(FormatType.HUMAN_READABLE, c.format().type());
    }

    @Test
    void parsesGraphDefinitions() throws ConfigError {
        FormatDescriptor d = parser.parse("""
                {
                  "type": 0,
                  "packet_delimiters": ["\\n"],
                  "packet_ids": ["temp", "tick"],
                  "graph_definitions": {
                    "temp": {
                      "title": "Temperature",
                      "x": {"packet_id": "tick", "use_time": true},
                      "y": {"packet_id": "temp", "y_axis": "C"}
                    },
                    "tick": {"y": {"packet_id": "tick"}}
                  }
                }
                """);

        Map<String, GraphDefinition> graphs = d.graphDefinitions();
        assertEquals(List.of("temp", "tick"), List.copyOf(graphs.keySet()));

        GraphDefinition temp = graphs.get("temp");
        assertEquals("Temperature", temp.title());
        assertEquals(OrderingMode.INLINE, temp.x().mode(), "inline takes precedence over time");
        assertEquals("C", temp.y().label());

        GraphDefinition tick = graphs.get("tick");
        assertNull(tick.title());
        assertEquals(OrderingMode.INDEX, tick.x().mode());
    }

    @Test
    void parsingTheSameDocumentTwiceYieldsEqualDescriptors() throws ConfigError {
        String json = """
                {"type": 1, "packet_delimiters": [";"], "packet_ids": ["t"], "specifiers": ["id", "data"],
                 "graph_definitions": {"t": {"x": {"use_time": true}, "y": {"packet_id": "t"}}}}
                """;
        assertEquals(parser.parse(json), parser.parse(json));
    }

    // ---------------------------------------------------------------------
    // Violations
    // ---------------------------------------------------------------------

    @Test
    void mismatchedHeaderLengthsFailWithThatViolation() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [3, 8, 1], "packet_ids": ["0x432000"]}
                """));
        assertEquals(1, e.violations().size());
        assertTrue(e.violations().get(0).contains("header_order and header_len must have equal length"),
                e.violations().toString());
    }

    @Test
    void collectsEveryViolationInsteadOfStoppingAtTheFirst() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {
                  "type": 1,
                  "packet_delimiters": "semicolon",
                  "packet_ids": [],
                  "specifiers": ["id"],
                  "graph_definitions": {"g": {"x": {"use_time": "yes"}}}
                }
                """));

        List<String> v = e.violations();
        assertTrue(v.contains("packet_ids must not be empty"), v.toString());
        assertTrue(v.contains("packet_delimiters must be a list of strings"), v.toString());
        assertTrue(v.stream().anyMatch(s -> s.startsWith("specifiers must have exactly 2 entries")), v.toString());
        assertTrue(v.contains("graph_definitions.g.x.use_time must be a boolean"), v.toString());
        assertTrue(v.contains("graph_definitions.g.y is required"), v.toString());
    }

    @Test
    void missingMandatoryFieldsAreReportedPerType() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("{\"type\": 3}"));
        assertEquals(List.of(
                "packet_ids is required",
                "header_order is required",
                "header_len is required"), e.violations());
    }

    @Test
    void rejectsUnknownTypeAndMissingType() {
        ConfigError unknown = assertThrows(ConfigError.class,
                () -> parser.parse("{\"type\": 7, \"packet_ids\": [\"a\"]}"));
        assertEquals(List.of("type has unknown value 7 (expected 0, 1, 2 or 3)"), unknown.violations());

        ConfigError missing = assertThrows(ConfigError.class,
                () -> parser.parse("{\"packet_ids\": [\"a\"]}"));
        assertEquals(List.of("type is required"), missing.violations());
    }

    @Test
    void rejectsBadHeaderEntries() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 3, "header_order": ["ID", "CRC"], "header_len": [0, 8], "packet_ids": ["0x1"]}
                """));
        assertTrue(e.violations().contains("header_order[1] has unknown value \"CRC\" (expected ID or DATA)"),
                e.violations().toString());
        assertTrue(e.violations().contains("header_len[0] must be an integer >= 1"), e.violations().toString());
    }

    @Test
    void requiresExactlyOneIdAndOneDataField() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 2, "header_order": ["ID", "ID"], "header_len": [1, 1], "packet_ids": ["0x01"]}
                """));
        assertEquals(List.of("header_order must contain exactly one ID and one DATA field"), e.violations());
    }

    @Test
    void binaryPacketIdsMustMatchTheIdFieldRendering() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [3, 8], "packet_ids": ["0x432", "0X432000"]}
                """));
        assertEquals(2, e.violations().size(), e.violations().toString());
    }

    @Test
    void badBinaryPacketIdIsReportedAlongsideOtherViolations() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [3, 8], "packet_ids": ["foo"],
                 "graph_definitions": {"g": {"y": {}}}}
                """));
        assertEquals(List.of(
                "packet_ids entry \"foo\" must be a lowercase 0x-prefixed hex value",
                "graph_definitions.g.y.packet_id is required"), e.violations());
    }

    @Test
    void idWidthMismatchIsReportedAlongsideOtherViolations() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 3, "header_order": ["ID", "DATA"], "header_len": [24, 8], "packet_ids": ["0x43"],
                 "graph_definitions": {"g": {"x": {"use_time": 1}, "y": {"packet_id": "0x43"}}}}
                """));
        assertEquals(List.of(
                "packet_ids entry \"0x43\" must have 6 hex digits to match the ID field",
                "graph_definitions.g.x.use_time must be a boolean"), e.violations());
    }

    @Test
    void typeOutsideIntRangeIsUnknownRatherThanTruncated() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 4294967296, "packet_delimiters": [";"], "packet_ids": ["a"]}
                """));
        assertEquals(List.of("type has unknown value 4294967296 (expected 0, 1, 2 or 3)"), e.violations());
    }

    /**
     * Oversized header lengths are configuration violations; they must never
     * overflow frame arithmetic or escape as unchecked exceptions.
     */
    @Test
    void oversizedHeaderLengthsAreViolations() {
        ConfigError bytes = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [1, 300000000], "packet_ids": ["0x01"]}
                """));
        assertEquals(List.of("header_len[1] must not exceed 65536 bytes"), bytes.violations());

        ConfigError bits = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 3, "header_order": ["ID", "DATA"], "header_len": [2147483647, 2147483647],
                 "packet_ids": ["0x1"]}
                """));
        assertEquals(List.of(
                "header_len[0] must not exceed 524288 bits",
                "header_len[1] must not exceed 524288 bits"), bits.violations());

        ConfigError total = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 3, "header_order": ["ID", "DATA"], "header_len": [300000, 300000], "packet_ids": ["0x1"]}
                """));
        assertEquals(List.of("header_len total of 600000 bits exceeds the 524288 bits frame limit"),
                total.violations());
    }

    @Test
    void largestFrameIsAccepted() throws ConfigError {
        EncodedCharsFormat f = (EncodedCharsFormat) parser.parse("""
                {"type": 2, "header_order": ["ID", "DATA"], "header_len": [1, 65535], "packet_ids": ["0x01"]}
                """);
        assertEquals(FrameLayout.MAX_FRAME_BITS, f.layout().totalBits());
    }

    @Test
    void graphPacketIdsMustBeWhitelisted() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("""
                {"type": 0, "packet_delimiters": ["\\n"], "packet_ids": ["a"],
                 "graph_definitions": {"b": {"x": {"packet_id": "z"}, "y": {"packet_id": "b"}}}}
                """));
        assertEquals(List.of(
                "graph_definitions.b.x.packet_id \"z\" is not listed in packet_ids",
                "graph_definitions.b.y.packet_id \"b\" is not listed in packet_ids"), e.violations());
    }

    @Test
    void prefixesViolationsInsideFullDocuments() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parseConfiguration("""
                {"packet_title": 5, "packet_format": {"type": 0, "packet_ids": ["a"]}}
                """));
        assertEquals(List.of(
                "packet_title must be a string",
                "packet_format.packet_delimiters is required"), e.violations());
    }

    @Test
    void malformedJsonIsAConfigError() {
        ConfigError e = assertThrows(ConfigError.class, () -> parser.parse("{\"type\": 0,"));
        assertEquals(1, e.violations().size());
        assertTrue(e.violations().get(0).startsWith("configuration is not valid JSON"));
        assertNotNull(e.getCause());
    }
}
