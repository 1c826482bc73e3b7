package com.questrail.telemetry.api;

import java.util.Optional;

/**
 * External accept/transform hook applied to every decoded packet.
 *
 * <p>The execution environment of a user filter is opaque to the decoding
 * core. Implementations return the (possibly transformed) value to accept the
 * packet, or {@link Optional#empty()} to reject it. Any exception thrown is
 * treated as a rejection of that packet only.</p>
 */
@FunctionalInterface
public interface PacketFilter
{
    /**
     * Filter that accepts every packet unchanged.
     */
    PacketFilter ACCEPT_ALL = (id, value) -> Optional.of(value);

    Optional<PacketValue> apply(String id, PacketValue value);
}
