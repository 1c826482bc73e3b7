package com.questrail.telemetry.config;

import java.util.Objects;

/**
 * A full packet configuration document: display metadata plus the packet
 * format. Metadata fields are {@code null} when absent.
 */
public record PacketConfiguration(
        String title,
        String description,
        String exampleLine,
        FormatDescriptor format
) {
    public PacketConfiguration {
        Objects.requireNonNull(format, "format");
    }
}
