package com.questrail.telemetry.filter;

import com.questrail.telemetry.api.PacketFilter;
import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.config.FormatDescriptor;
import com.questrail.telemetry.observability.DecodeObservabilitySink;
import com.questrail.telemetry.observability.FilterRejectedEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FilterStage
 * -----------------------------------------------------------------------------
 * Applied to every decoded packet before routing:
 *
 * <ol>
 *   <li>packet id whitelist check (decoders already filter; this guards
 *       against packets decoded under a previous configuration)</li>
 *   <li>the external {@link PacketFilter} hook, which may reject the packet or
 *       replace its value</li>
 * </ol>
 *
 * A filter that rejects, returns {@code null}, or throws causes only that
 * packet to be dropped. The stream is never aborted.
 */
public final class FilterStage
{
    private final Set<String> packetIds;
    private final PacketFilter filter;
    private final DecodeObservabilitySink sink;

    public FilterStage(Set<String> packetIds, PacketFilter filter, DecodeObservabilitySink sink) {
        this.packetIds = Set.copyOf(Objects.requireNonNull(packetIds, "packetIds"));
        this.filter = Objects.requireNonNullElse(filter, PacketFilter.ACCEPT_ALL);
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public static FilterStage forDescriptor(FormatDescriptor descriptor, DecodeObservabilitySink sink) {
        return new FilterStage(descriptor.packetIds(), descriptor.filter(), sink);
    }

    /**
     * @return the accepted (possibly transformed) packet, or empty if rejected
     */
    public Optional<ParsedPacket> apply(ParsedPacket packet) {
        Objects.requireNonNull(packet, "packet");

        if (!packetIds.contains(packet.id())) {
            reject(packet, "packet id not in the active configuration", null);
            return Optional.empty();
        }
        if (filter == PacketFilter.ACCEPT_ALL) {
            return Optional.of(packet);
        }

        final Optional<PacketValue> result;
        try {
            result = filter.apply(packet.id(), packet.value());
        }
        catch (RuntimeException e) {
            reject(packet, "filter threw " + e.getClass().getSimpleName(), e);
            return Optional.empty();
        }

        if (result == null || result.isEmpty()) {
            reject(packet, "filter rejected packet", null);
            return Optional.empty();
        }

        PacketValue value = result.get();
        return Optional.of(value.equals(packet.value()) ? packet : packet.withValue(value));
    }

    private void reject(ParsedPacket packet, String reason, Throwable cause) {
        sink.onFilterRejected(new FilterRejectedEvent(Instant.now(), packet.id(), reason, cause));
    }
}
