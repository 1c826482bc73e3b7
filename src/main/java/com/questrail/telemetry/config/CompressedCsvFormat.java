package com.questrail.telemetry.config;

import com.questrail.telemetry.api.PacketFilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Type 1: compressed CSV, a stream of {@code specifier<delim>value} tokens in
 * which an id token is followed by its data token.
 *
 * @param idSpecifier   specifier marking an id token ({@code specifiers[0]})
 * @param dataSpecifier specifier marking a data token ({@code specifiers[1]})
 */
public record CompressedCsvFormat(
        List<String> packetDelimiters,
        Set<String> packetIds,
        String idSpecifier,
        String dataSpecifier,
        List<String> dataDelimiters,
        Map<String, GraphDefinition> graphDefinitions,
        PacketFilter filter
) implements FormatDescriptor
{
    /** Data delimiter used when a type 1 document declares none. */
    public static final List<String> DEFAULT_DATA_DELIMITERS = List.of(":");

    public CompressedCsvFormat {
        packetDelimiters = List.copyOf(packetDelimiters);
        packetIds = Collections.unmodifiableSet(new LinkedHashSet<>(packetIds));
        Objects.requireNonNull(idSpecifier, "idSpecifier");
        Objects.requireNonNull(dataSpecifier, "dataSpecifier");
        dataDelimiters = List.copyOf(dataDelimiters);
        graphDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(graphDefinitions));
        filter = Objects.requireNonNullElse(filter, PacketFilter.ACCEPT_ALL);
    }

    @Override
    public FormatType type() {
        return FormatType.COMPRESSED_CSV;
    }

    @Override
    public CompressedCsvFormat withFilter(PacketFilter filter) {
        return new CompressedCsvFormat(packetDelimiters, packetIds, idSpecifier, dataSpecifier,
                dataDelimiters, graphDefinitions, filter);
    }

    @Override
    public <R> R accept(FormatDescriptorVisitor<R> visitor) {
        return visitor.visitCompressedCsv(this);
    }
}
