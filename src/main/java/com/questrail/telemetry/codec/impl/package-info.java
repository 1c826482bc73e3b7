/**
 * Concrete decoders for the four packet format types.
 *
 * <pre>
 *   type 0  HumanReadableDecoder   split, id/data split, whitelist, ignore scrub
 *   type 1  CompressedCsvDecoder   split, specifier pairing, whitelist
 *   type 2  EncodedCharsDecoder    byte frames, hex id match
 *   type 3  EncodedBitsDecoder     bit frames (MSB padded), hex id match
 * </pre>
 *
 * <p>Any unit that fails its format's rules is dropped and reported to the
 * observability sink as a resync; decoding continues with the next unit.</p>
 */
package com.questrail.telemetry.codec.impl;
