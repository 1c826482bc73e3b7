/**
 * Upstream Transport Port
 * =============================================================================
 *
 * The serial port reader lives outside this library. It feeds the decoding
 * core through {@link com.questrail.telemetry.transport.ByteStreamListener},
 * which sees only:
 * <ul>
 *   <li>raw stream chunks as {@code byte[]}, in arrival order</li>
 *   <li>connection lifecycle notifications (connected / disconnected)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Readers MUST deliver chunks from a single thread and MUST NOT interpret
 * the bytes; all framing and decoding happens behind the listener.
 */
package com.questrail.telemetry.transport;
