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
 * Type 3: fixed-length binary frames whose fields are packed at bit
 * granularity. Frames are left-padded with zero bits to a byte boundary.
 *
 * @param headerOrder field tags in wire order
 * @param headerLen   field lengths in bits, parallel to {@code headerOrder}
 */
public record EncodedBitsFormat(
        List<HeaderField> headerOrder,
        List<Integer> headerLen,
        Set<String> packetIds,
        Map<String, GraphDefinition> graphDefinitions,
        PacketFilter filter
) implements FormatDescriptor
{
    public EncodedBitsFormat {
        headerOrder = List.copyOf(headerOrder);
        headerLen = List.copyOf(headerLen);
        packetIds = Collections.unmodifiableSet(new LinkedHashSet<>(packetIds));
        graphDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(graphDefinitions));
        filter = Objects.requireNonNullElse(filter, PacketFilter.ACCEPT_ALL);
    }

    public FrameLayout layout() {
        return new FrameLayout(headerOrder, headerLen);
    }

    @Override
    public FormatType type() {
        return FormatType.ENCODED_BITS;
    }

    @Override
    public EncodedBitsFormat withFilter(PacketFilter filter) {
        return new EncodedBitsFormat(headerOrder, headerLen, packetIds, graphDefinitions, filter);
    }

    @Override
    public <R> R accept(FormatDescriptorVisitor<R> visitor) {
        return visitor.visitEncodedBits(this);
    }
}
