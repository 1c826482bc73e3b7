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
 * Type 2: fixed-length binary frames whose fields are whole bytes.
 *
 * @param headerOrder field tags in wire order
 * @param headerLen   field lengths in bytes, parallel to {@code headerOrder}
 */
public record EncodedCharsFormat(
        List<HeaderField> headerOrder,
        List<Integer> headerLen,
        Set<String> packetIds,
        Map<String, GraphDefinition> graphDefinitions,
        PacketFilter filter
) implements FormatDescriptor
{
    public EncodedCharsFormat {
        headerOrder = List.copyOf(headerOrder);
        headerLen = List.copyOf(headerLen);
        packetIds = Collections.unmodifiableSet(new LinkedHashSet<>(packetIds));
        graphDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(graphDefinitions));
        filter = Objects.requireNonNullElse(filter, PacketFilter.ACCEPT_ALL);
    }

    public FrameLayout layout() {
        return FrameLayout.ofBytes(headerOrder, headerLen);
    }

    /** Frame length in bytes. */
    public int frameLength() {
        int total = 0;
        for (int len : headerLen) {
            total += len;
        }
        return total;
    }

    @Override
    public FormatType type() {
        return FormatType.ENCODED_CHARS;
    }

    @Override
    public EncodedCharsFormat withFilter(PacketFilter filter) {
        return new EncodedCharsFormat(headerOrder, headerLen, packetIds, graphDefinitions, filter);
    }

    @Override
    public <R> R accept(FormatDescriptorVisitor<R> visitor) {
        return visitor.visitEncodedChars(this);
    }
}
