package com.questrail.telemetry.config;

/**
 * Visitor over the {@link FormatDescriptor} variants.
 */
public interface FormatDescriptorVisitor<R>
{
    R visitHumanReadable(HumanReadableFormat format);

    R visitCompressedCsv(CompressedCsvFormat format);

    R visitEncodedChars(EncodedCharsFormat format);

    R visitEncodedBits(EncodedBitsFormat format);
}
