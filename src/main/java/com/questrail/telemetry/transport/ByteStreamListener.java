package com.questrail.telemetry.transport;

/**
 * ByteStreamListener
 * -----------------------------------------------------------------------------
 * Callback sink for the serial reader that owns the physical port.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner, in
 * arrival order. The reader itself (port discovery, baud rate, blocking reads)
 * lives outside the decoding core.</p>
 */
public interface ByteStreamListener
{
    /**
     * Called when the port has been opened and bytes may follow.
     */
    void onConnected();

    /**
     * Called with each chunk read from the port, in arrival order.
     *
     * @param chunk raw bytes; non-empty
     */
    void onChunk(byte[] chunk);

    /**
     * Called when the port closes, by user request or by failure.
     *
     * @param cause diagnostic cause; {@code null} for an orderly disconnect
     */
    void onDisconnected(Throwable cause);
}
