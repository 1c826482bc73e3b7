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
 * Type 0: human readable text.
 *
 * <p>Packets are split on {@code packetDelimiters}; each packet is split once on
 * the first occurring {@code dataDelimiters} entry into id and data; every
 * {@code ignore} string is scrubbed from the data.</p>
 */
public record HumanReadableFormat(
        List<String> packetDelimiters,
        Set<String> packetIds,
        List<String> dataDelimiters,
        List<String> ignore,
        Map<String, GraphDefinition> graphDefinitions,
        PacketFilter filter
) implements FormatDescriptor
{
    public HumanReadableFormat {
        packetDelimiters = List.copyOf(packetDelimiters);
        packetIds = Collections.unmodifiableSet(new LinkedHashSet<>(packetIds));
        dataDelimiters = List.copyOf(dataDelimiters);
        ignore = List.copyOf(ignore);
        graphDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(graphDefinitions));
        filter = Objects.requireNonNullElse(filter, PacketFilter.ACCEPT_ALL);
    }

    @Override
    public FormatType type() {
        return FormatType.HUMAN_READABLE;
    }

    @Override
    public HumanReadableFormat withFilter(PacketFilter filter) {
        return new HumanReadableFormat(packetDelimiters, packetIds, dataDelimiters, ignore, graphDefinitions, filter);
    }

    @Override
    public <R> R accept(FormatDescriptorVisitor<R> visitor) {
        return visitor.visitHumanReadable(this);
    }
}
