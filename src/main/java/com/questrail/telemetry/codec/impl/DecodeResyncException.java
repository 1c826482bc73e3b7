package com.questrail.telemetry.codec.impl;

/**
 * Indicates that one fragment or frame failed its format's matching rule.
 *
 * This typically reflects:
 * <ul>
 *   <li>An id not listed in the configured packet ids</li>
 *   <li>A broken id/data pairing (type 1)</li>
 *   <li>A token missing its data delimiter (type 1)</li>
 * </ul>
 *
 * The offending unit is dropped and decoding continues with the next unit.
 * This exception never leaves the decoder.
 */
final class DecodeResyncException extends RuntimeException
{
    DecodeResyncException(String message) {
        super(message, null, false, false);
    }
}
