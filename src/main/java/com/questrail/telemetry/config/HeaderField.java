package com.questrail.telemetry.config;

/**
 * Field tags allowed in {@code header_order} for the binary formats.
 */
public enum HeaderField
{
    ID,
    DATA
}
