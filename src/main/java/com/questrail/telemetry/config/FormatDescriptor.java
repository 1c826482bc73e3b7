package com.questrail.telemetry.config;

import com.questrail.telemetry.api.PacketFilter;

import java.util.Map;
import java.util.Set;

/**
 * FormatDescriptor
 * =============================================================================
 * Immutable, validated description of one packet format.
 *
 * <h2>Variants</h2>
 * The descriptor is a closed set of tagged variants, one per wire encoding.
 * Each variant carries only the fields meaningful for its type:
 *
 * <ul>
 *   <li>{@link HumanReadableFormat} (type 0)</li>
 *   <li>{@link CompressedCsvFormat} (type 1)</li>
 *   <li>{@link EncodedCharsFormat} (type 2)</li>
 *   <li>{@link EncodedBitsFormat} (type 3)</li>
 * </ul>
 *
 * <p>Consumers branch on the variant through {@link #accept(FormatDescriptorVisitor)}
 * rather than on raw type codes.</p>
 *
 * <h2>Lifecycle</h2>
 * A descriptor is built once per loaded configuration by
 * {@link FormatDescriptorParser} and replaced atomically when a new
 * configuration loads.
 */
public sealed interface FormatDescriptor
        permits HumanReadableFormat, CompressedCsvFormat, EncodedCharsFormat, EncodedBitsFormat {

    FormatType type();

    /**
     * Whitelisted packet ids; never empty.
     */
    Set<String> packetIds();

    /**
     * Graph definitions keyed by series id, in document order.
     */
    Map<String, GraphDefinition> graphDefinitions();

    /**
     * External filter hook; {@link PacketFilter#ACCEPT_ALL} when none is configured.
     */
    PacketFilter filter();

    /**
     * Returns a copy of this descriptor using the given filter hook.
     */
    FormatDescriptor withFilter(PacketFilter filter);

    <R> R accept(FormatDescriptorVisitor<R> visitor);
}
