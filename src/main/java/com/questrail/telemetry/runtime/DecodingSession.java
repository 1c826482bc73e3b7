package com.questrail.telemetry.runtime;

import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.api.Sample;
import com.questrail.telemetry.codec.PacketDecoder;
import com.questrail.telemetry.codec.PacketSequencer;
import com.questrail.telemetry.codec.impl.PacketDecoders;
import com.questrail.telemetry.config.FormatDescriptor;
import com.questrail.telemetry.filter.FilterStage;
import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.observability.DecodeErrorEvent;
import com.questrail.telemetry.observability.DecodeObservabilitySink;
import com.questrail.telemetry.series.SeriesRouter;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DecodingSession
 * =============================================================================
 * The decode, filter and route pipeline for one connection under one
 * configuration.
 *
 * <pre>
 *   chunk
 *     → PacketDecoder   (type selected by the descriptor)
 *         → FilterStage
 *             → packet channel          (raw monitor / CSV capture)
 *             → SeriesRouter
 *                 → sample channel      (graph rendering)
 * </pre>
 *
 * <h2>Ownership</h2>
 * All mutable state (decoder buffers, pending id, series) is created with the
 * session and discarded with it. There is no process-wide decoder state; a
 * reconnect or reload builds a new session.
 *
 * <h2>Cancellation</h2>
 * {@link #cancel()} may be called from any thread. The decoder checks the flag
 * before every fragment or frame, dropped ones included, so nothing is decoded
 * after cancellation even when bytes remain buffered.
 */
public final class DecodingSession
{
    private final FormatDescriptor descriptor;
    private final PacketDecoder decoder;
    private final PacketSequencer sequencer;
    private final FilterStage filter;
    private final SeriesRouter router;
    private final HandoffChannel<ParsedPacket> packets;
    private final HandoffChannel<Sample> samples;
    private final DecodeObservabilitySink sink;

    private volatile boolean cancelled;
    private boolean closed;

    public DecodingSession(FormatDescriptor descriptor,
                           MonotonicClock clock,
                           DecodeObservabilitySink sink,
                           HandoffChannel<ParsedPacket> packets,
                           HandoffChannel<Sample> samples) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.packets = Objects.requireNonNull(packets, "packets");
        this.samples = Objects.requireNonNull(samples, "samples");
        this.sequencer = new PacketSequencer(Objects.requireNonNull(clock, "clock"));
        this.decoder = PacketDecoders.create(descriptor, sequencer, sink);
        this.filter = FilterStage.forDescriptor(descriptor, sink);
        this.router = SeriesRouter.forDescriptor(descriptor);
    }

    /**
     * Decodes one chunk and publishes every packet and sample it completes.
     * Incomplete trailing input stays buffered for the next chunk.
     */
    public void accept(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (cancelled) {
            release();
            return;
        }
        decoder.append(chunk);

        while (!cancelled) {
            final Optional<ParsedPacket> decoded;
            try {
                decoded = decoder.poll(this::isCancelled);
            }
            catch (RuntimeException e) {
                // A decoder fault must not wedge the stream: drop what is buffered.
                sink.onError(new DecodeErrorEvent(Instant.now(), "decoder fault; buffered input discarded", e));
                decoder.reset();
                return;
            }
            if (decoded.isEmpty()) {
                break;
            }

            Optional<ParsedPacket> accepted = filter.apply(decoded.get());
            if (accepted.isEmpty()) {
                continue;
            }
            packets.offer(accepted.get());

            List<Sample> routed = router.route(accepted.get());
            for (Sample s : routed) {
                samples.offer(s);
            }
        }

        if (cancelled) {
            release();
        }
    }

    /**
     * Stops decoding. Safe to call from any thread; buffered bytes are
     * discarded by the consumer on its next call.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public FormatDescriptor descriptor() {
        return descriptor;
    }

    public SeriesRouter router() {
        return router;
    }

    /**
     * Number of packets emitted by the decoder so far, before filtering.
     */
    public long decodedCount() {
        return sequencer.emitted();
    }

    /**
     * Releases decoder buffers. Must be called from the consumer thread, or
     * after the consumer has stopped.
     */
    void release() {
        if (!closed) {
            closed = true;
            decoder.close();
        }
    }
}
