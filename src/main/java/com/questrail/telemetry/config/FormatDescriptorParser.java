package com.questrail.telemetry.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * FormatDescriptorParser
 * =============================================================================
 * Parses and validates packet configuration documents into immutable
 * {@link FormatDescriptor} instances.
 *
 * <h2>Accepted documents</h2>
 * <ul>
 *   <li>a bare packet format object: {@code {"type": 0, "packet_ids": [...], ...}}</li>
 *   <li>a full configuration: {@code {"packet_title": ..., "packet_format": {...}}}</li>
 * </ul>
 *
 * <h2>Mandatory fields by type</h2>
 * <pre>
 *   type 0 : packet_delimiters, packet_ids
 *   type 1 : packet_delimiters, packet_ids, specifiers (2 entries)
 *   type 2 : header_order, header_len (bytes), packet_ids
 *   type 3 : header_order, header_len (bits),  packet_ids
 * </pre>
 *
 * <h2>Validation policy</h2>
 * Every violation found in the document is collected before failing, so one
 * {@link ConfigError} reports all problems at once. Parsing is a pure function
 * of its input: the same document always produces an equal descriptor.
 *
 * <p>Keys not used by the declared type are ignored.</p>
 */
public final class FormatDescriptorParser
{
    private static final Pattern HEX_ID = Pattern.compile("0x[0-9a-f]+");

    private final ObjectMapper mapper;

    public FormatDescriptorParser() {
        this(new ObjectMapper());
    }

    public FormatDescriptorParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Parses a full packet configuration (or a bare packet format) from JSON text.
     *
     * @throws ConfigError if the text is not JSON or the document is invalid
     */
    public PacketConfiguration parseConfiguration(String json) throws ConfigError {
        return parseConfiguration(readTree(json));
    }

    public PacketConfiguration parseConfiguration(JsonNode document) throws ConfigError {
        Objects.requireNonNull(document, "document");
        if (!document.isObject()) {
            throw new ConfigError(List.of("configuration must be a JSON object"));
        }

        JsonNode format = document.get("packet_format");
        if (format == null) {
            return new PacketConfiguration(null, null, null, parseFormat(document));
        }

        List<String> violations = new ArrayList<>();
        String title = optionalString(document, "packet_title", "packet_title", violations);
        String description = optionalString(document, "packet_description", "packet_description", violations);
        String example = optionalString(document, "example_line", "example_line", violations);

        FormatDescriptor descriptor = null;
        try {
            descriptor = parseFormat(format, "packet_format.");
        }
        catch (ConfigError e) {
            violations.addAll(e.violations());
        }

        if (!violations.isEmpty()) {
            throw new ConfigError(violations);
        }
        return new PacketConfiguration(title, description, example, descriptor);
    }

    /**
     * Parses a packet format from JSON text. A full configuration document is
     * also accepted; its metadata is discarded.
     *
     * @throws ConfigError if the text is not JSON or the format is invalid
     */
    public FormatDescriptor parse(String json) throws ConfigError {
        return parseConfiguration(json).format();
    }

    /**
     * Parses a bare packet format object.
     *
     * @throws ConfigError listing every violation found
     */
    public FormatDescriptor parseFormat(JsonNode format) throws ConfigError {
        return parseFormat(format, "");
    }

    // ------------------------------------------------------------------------
    // Format
    // ------------------------------------------------------------------------

    private FormatDescriptor parseFormat(JsonNode node, String prefix) throws ConfigError {
        List<String> violations = new ArrayList<>();
        if (node == null || !node.isObject()) {
            throw new ConfigError(List.of(name(prefix, "packet format") + " must be a JSON object"));
        }

        FormatType type = parseType(node, prefix, violations);
        Set<String> packetIds = parsePacketIds(node, prefix, violations);

        FormatDescriptor descriptor = null;
        if (type != null) {
            descriptor = switch (type) {
                case HUMAN_READABLE -> parseHumanReadable(node, prefix, packetIds, violations);
                case COMPRESSED_CSV -> parseCompressedCsv(node, prefix, packetIds, violations);
                case ENCODED_CHARS, ENCODED_BITS -> parseEncoded(type, node, prefix, packetIds, violations);
            };
        }

        if (!violations.isEmpty()) {
            throw new ConfigError(violations);
        }
        return descriptor;
    }

    private FormatType parseType(JsonNode node, String prefix, List<String> violations) {
        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            violations.add(name(prefix, "type") + " is required");
            return null;
        }
        if (!type.isIntegralNumber()) {
            violations.add(name(prefix, "type") + " must be an integer");
            return null;
        }
        if (!type.canConvertToInt() || type.asInt() < 0 || type.asInt() > 3) {
            violations.add(name(prefix, "type") + " has unknown value " + type.asText() + " (expected 0, 1, 2 or 3)");
            return null;
        }
        return FormatType.fromCode(type.asInt());
    }

    private Set<String> parsePacketIds(JsonNode node, String prefix, List<String> violations) {
        List<String> ids = stringList(node, "packet_ids", prefix, true, violations);
        if (ids == null) {
            return Set.of();
        }
        if (ids.isEmpty()) {
            violations.add(name(prefix, "packet_ids") + " must not be empty");
        }
        return new LinkedHashSet<>(ids);
    }

    private FormatDescriptor parseHumanReadable(JsonNode node,
                                                String prefix,
                                                Set<String> packetIds,
                                                List<String> violations) {
        List<String> packetDelimiters = requireDelimiters(node, "packet_delimiters", prefix, violations);
        List<String> dataDelimiters = optionalDelimiters(node, "data_delimiters", prefix, violations);
        List<String> ignore = optionalDelimiters(node, "ignore", prefix, violations);
        Map<String, GraphDefinition> graphs = parseGraphDefinitions(node, prefix, packetIds, violations);

        if (!violations.isEmpty()) {
            return null;
        }
        return new HumanReadableFormat(packetDelimiters,
                packetIds,
                dataDelimiters == null ? List.of() : dataDelimiters,
                ignore == null ? List.of() : ignore,
                graphs,
                null);
    }

    private FormatDescriptor parseCompressedCsv(JsonNode node,
                                                String prefix,
                                                Set<String> packetIds,
                                                List<String> violations) {
        List<String> packetDelimiters = requireDelimiters(node, "packet_delimiters", prefix, violations);
        List<String> dataDelimiters = optionalDelimiters(node, "data_delimiters", prefix, violations);

        List<String> specifiers = stringList(node, "specifiers", prefix, true, violations);
        if (specifiers != null) {
            if (specifiers.size() != 2) {
                violations.add(name(prefix, "specifiers") + " must have exactly 2 entries (id, data), found "
                        + specifiers.size());
            }
            else if (specifiers.get(0).isEmpty() || specifiers.get(1).isEmpty()) {
                violations.add(name(prefix, "specifiers") + " entries must not be empty");
            }
            else if (specifiers.get(0).equals(specifiers.get(1))) {
                violations.add(name(prefix, "specifiers") + " id and data specifiers must differ");
            }
        }
        Map<String, GraphDefinition> graphs = parseGraphDefinitions(node, prefix, packetIds, violations);

        if (!violations.isEmpty()) {
            return null;
        }
        return new CompressedCsvFormat(packetDelimiters,
                packetIds,
                specifiers.get(0),
                specifiers.get(1),
                dataDelimiters == null ? CompressedCsvFormat.DEFAULT_DATA_DELIMITERS : dataDelimiters,
                graphs,
                null);
    }

    private FormatDescriptor parseEncoded(FormatType type,
                                          JsonNode node,
                                          String prefix,
                                          Set<String> packetIds,
                                          List<String> violations) {
        final int bitsPerUnit = (type == FormatType.ENCODED_CHARS) ? 8 : 1;
        List<HeaderField> order = parseHeaderOrder(node, prefix, violations);
        List<Integer> lengths = parseHeaderLen(node, prefix, bitsPerUnit, violations);

        boolean geometry = order != null && lengths != null;
        if (geometry && order.size() != lengths.size()) {
            violations.add(name(prefix, "header_order") + " and " + name(prefix, "header_len")
                    + " must have equal length (header_order has " + order.size()
                    + " entries, header_len has " + lengths.size() + ")");
            geometry = false;
        }
        if (order != null) {
            int ids = countOf(order, HeaderField.ID);
            int data = countOf(order, HeaderField.DATA);
            if (ids != 1 || data != 1) {
                violations.add(name(prefix, "header_order") + " must contain exactly one ID and one DATA field");
                geometry = geometry && ids == 1;
            }
        }

        // Packet ids are always checked; the digit count only once the ID width is known.
        int digits = -1;
        if (geometry) {
            int idBits = lengths.get(order.indexOf(HeaderField.ID)) * bitsPerUnit;
            digits = (idBits + 3) / 4;
        }
        for (String id : packetIds) {
            if (!HEX_ID.matcher(id).matches()) {
                violations.add(name(prefix, "packet_ids") + " entry \"" + id
                        + "\" must be a lowercase 0x-prefixed hex value");
            }
            else if (digits > 0 && id.length() - 2 != digits) {
                violations.add(name(prefix, "packet_ids") + " entry \"" + id + "\" must have " + digits + " hex digit"
                        + (digits == 1 ? "" : "s") + " to match the ID field");
            }
        }

        Map<String, GraphDefinition> graphs = parseGraphDefinitions(node, prefix, packetIds, violations);

        if (!violations.isEmpty()) {
            return null;
        }
        return (type == FormatType.ENCODED_CHARS)
                ? new EncodedCharsFormat(order, lengths, packetIds, graphs, null)
                : new EncodedBitsFormat(order, lengths, packetIds, graphs, null);
    }

    private List<HeaderField> parseHeaderOrder(JsonNode node, String prefix, List<String> violations) {
        List<String> raw = stringList(node, "header_order", prefix, true, violations);
        if (raw == null) {
            return null;
        }
        List<HeaderField> order = new ArrayList<>(raw.size());
        boolean valid = true;
        for (int i = 0; i < raw.size(); i++) {
            String tag = raw.get(i);
            if ("ID".equals(tag)) {
                order.add(HeaderField.ID);
            }
            else if ("DATA".equals(tag)) {
                order.add(HeaderField.DATA);
            }
            else {
                violations.add(name(prefix, "header_order") + "[" + i + "] has unknown value \"" + tag
                        + "\" (expected ID or DATA)");
                valid = false;
            }
        }
        return valid ? order : null;
    }

    /**
     * Reads field lengths in the format's unit (bytes for type 2, bits for
     * type 3). The whole frame must fit {@link FrameLayout#MAX_FRAME_BITS}.
     */
    private List<Integer> parseHeaderLen(JsonNode node, String prefix, int bitsPerUnit, List<String> violations) {
        JsonNode array = node.get("header_len");
        if (array == null || array.isNull()) {
            violations.add(name(prefix, "header_len") + " is required");
            return null;
        }
        if (!array.isArray()) {
            violations.add(name(prefix, "header_len") + " must be a list of integers");
            return null;
        }
        final long maxUnits = FrameLayout.MAX_FRAME_BITS / bitsPerUnit;
        final String unit = bitsPerUnit == 8 ? "bytes" : "bits";

        List<Integer> lengths = new ArrayList<>(array.size());
        boolean valid = true;
        long total = 0;
        for (int i = 0; i < array.size(); i++) {
            JsonNode entry = array.get(i);
            if (!entry.isIntegralNumber() || !entry.canConvertToLong() || entry.asLong() < 1) {
                violations.add(name(prefix, "header_len") + "[" + i + "] must be an integer >= 1");
                valid = false;
            }
            else if (entry.asLong() > maxUnits) {
                violations.add(name(prefix, "header_len") + "[" + i + "] must not exceed " + maxUnits + " " + unit);
                valid = false;
            }
            else {
                lengths.add(entry.asInt());
                total += entry.asLong();
            }
        }
        if (valid && total > maxUnits) {
            violations.add(name(prefix, "header_len") + " total of " + total + " " + unit
                    + " exceeds the " + maxUnits + " " + unit + " frame limit");
            valid = false;
        }
        return valid ? lengths : null;
    }

    // ------------------------------------------------------------------------
    // Graph definitions
    // ------------------------------------------------------------------------

    private Map<String, GraphDefinition> parseGraphDefinitions(JsonNode node,
                                                               String prefix,
                                                               Set<String> packetIds,
                                                               List<String> violations) {
        Map<String, GraphDefinition> graphs = new LinkedHashMap<>();
        JsonNode defs = node.get("graph_definitions");
        if (defs == null || defs.isNull()) {
            return graphs;
        }
        if (!defs.isObject()) {
            violations.add(name(prefix, "graph_definitions") + " must be an object");
            return graphs;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = defs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String path = name(prefix, "graph_definitions") + "." + entry.getKey();
            GraphDefinition def = parseGraphDefinition(entry.getValue(), path, packetIds, violations);
            if (def != null) {
                graphs.put(entry.getKey(), def);
            }
        }
        return graphs;
    }

    private GraphDefinition parseGraphDefinition(JsonNode node,
                                                 String path,
                                                 Set<String> packetIds,
                                                 List<String> violations) {
        if (!node.isObject()) {
            violations.add(path + " must be an object");
            return null;
        }
        int before = violations.size();

        String title = optionalString(node, "title", path + ".title", violations);

        GraphDefinition.XAxis x = GraphDefinition.XAxis.DEFAULT;
        JsonNode xNode = node.get("x");
        if (xNode != null && !xNode.isNull()) {
            if (!xNode.isObject()) {
                violations.add(path + ".x must be an object");
            }
            else {
                boolean useTime = false;
                JsonNode useTimeNode = xNode.get("use_time");
                if (useTimeNode != null && !useTimeNode.isNull()) {
                    if (!useTimeNode.isBoolean()) {
                        violations.add(path + ".x.use_time must be a boolean");
                    }
                    else {
                        useTime = useTimeNode.asBoolean();
                    }
                }
                String indexId = optionalString(xNode, "packet_id", path + ".x.packet_id", violations);
                if (indexId != null && !packetIds.contains(indexId)) {
                    violations.add(path + ".x.packet_id \"" + indexId + "\" is not listed in packet_ids");
                }
                String label = optionalString(xNode, "x_axis", path + ".x.x_axis", violations);
                x = new GraphDefinition.XAxis(useTime, indexId, label);
            }
        }

        GraphDefinition.YAxis y = null;
        JsonNode yNode = node.get("y");
        if (yNode == null || yNode.isNull()) {
            violations.add(path + ".y is required");
        }
        else if (!yNode.isObject()) {
            violations.add(path + ".y must be an object");
        }
        else {
            String dataId = null;
            JsonNode dataIdNode = yNode.get("packet_id");
            if (dataIdNode == null || dataIdNode.isNull()) {
                violations.add(path + ".y.packet_id is required");
            }
            else {
                dataId = optionalString(yNode, "packet_id", path + ".y.packet_id", violations);
                if (dataId != null && !packetIds.contains(dataId)) {
                    violations.add(path + ".y.packet_id \"" + dataId + "\" is not listed in packet_ids");
                }
            }
            String label = optionalString(yNode, "y_axis", path + ".y.y_axis", violations);
            if (dataId != null) {
                y = new GraphDefinition.YAxis(dataId, label);
            }
        }

        if (violations.size() != before) {
            return null;
        }
        return new GraphDefinition(title, x, y);
    }

    // ------------------------------------------------------------------------
    // Primitive helpers
    // ------------------------------------------------------------------------

    private JsonNode readTree(String json) throws ConfigError {
        Objects.requireNonNull(json, "json");
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new ConfigError(List.of("configuration document is empty"));
            }
            return node;
        }
        catch (JsonProcessingException e) {
            throw new ConfigError("configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<String> requireDelimiters(JsonNode node, String field, String prefix, List<String> violations) {
        List<String> values = stringList(node, field, prefix, true, violations);
        if (values == null) {
            return null;
        }
        if (values.isEmpty()) {
            violations.add(name(prefix, field) + " must not be empty");
        }
        checkNonEmptyEntries(values, field, prefix, violations);
        return values;
    }

    private List<String> optionalDelimiters(JsonNode node, String field, String prefix, List<String> violations) {
        List<String> values = stringList(node, field, prefix, false, violations);
        if (values != null) {
            checkNonEmptyEntries(values, field, prefix, violations);
        }
        return values;
    }

    private void checkNonEmptyEntries(List<String> values, String field, String prefix, List<String> violations) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).isEmpty()) {
                violations.add(name(prefix, field) + "[" + i + "] must not be an empty string");
            }
        }
    }

    /**
     * Reads a list of strings. Returns {@code null} when the field is absent
     * or malformed (a violation is recorded for malformed, and for absent when
     * {@code required}).
     */
    private List<String> stringList(JsonNode node,
                                    String field,
                                    String prefix,
                                    boolean required,
                                    List<String> violations) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            if (required) {
                violations.add(name(prefix, field) + " is required");
            }
            return null;
        }
        if (!array.isArray()) {
            violations.add(name(prefix, field) + " must be a list of strings");
            return null;
        }
        List<String> values = new ArrayList<>(array.size());
        boolean valid = true;
        for (int i = 0; i < array.size(); i++) {
            JsonNode entry = array.get(i);
            if (!entry.isTextual()) {
                violations.add(name(prefix, field) + "[" + i + "] must be a string");
                valid = false;
            }
            else {
                values.add(entry.asText());
            }
        }
        return valid ? values : null;
    }

    private String optionalString(JsonNode node, String field, String path, List<String> violations) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            violations.add(path + " must be a string");
            return null;
        }
        return value.asText();
    }

    private static int countOf(List<HeaderField> order, HeaderField field) {
        int n = 0;
        for (HeaderField f : order) {
            if (f == field) {
                n++;
            }
        }
        return n;
    }

    private static String name(String prefix, String field) {
        return prefix + field;
    }
}
