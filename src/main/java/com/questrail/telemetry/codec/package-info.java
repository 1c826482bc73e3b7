/**
 * Packet Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the telemetry
 * decoder: the contracts and stream mechanics that turn raw serial bytes into
 * identified packets.</p>
 *
 * <ul>
 *   <li>delimiter splitting for the text formats ({@link com.questrail.telemetry.codec.DelimitedSplitter})</li>
 *   <li>fixed-length frame cutting for the binary formats
 *       ({@link com.questrail.telemetry.codec.FixedLengthChunker})</li>
 *   <li>the decoder contract ({@link com.questrail.telemetry.codec.PacketDecoder})</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk
 *        → DelimitedSplitter / FixedLengthChunker   (framing)
 *            → PacketDecoder                         (format rules)
 *                → ParsedPacket
 *                    → filter stage, series router
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Incomplete input is never an error; it waits for the next chunk.</li>
 *   <li>Malformed input is dropped one fragment or frame at a time.</li>
 *   <li>Netty buffers are used internally and never appear in a signature.</li>
 * </ul>
 */
package com.questrail.telemetry.codec;
