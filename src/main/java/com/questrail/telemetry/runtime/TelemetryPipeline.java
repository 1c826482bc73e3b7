package com.questrail.telemetry.runtime;

import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.api.Sample;
import com.questrail.telemetry.config.ConfigError;
import com.questrail.telemetry.config.FormatDescriptor;
import com.questrail.telemetry.config.FormatDescriptorParser;
import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.internal.time.SystemMonotonicClock;
import com.questrail.telemetry.observability.DecodeObservabilitySink;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.SessionLifecycleEvent;
import com.questrail.telemetry.series.SeriesRouter;
import com.questrail.telemetry.transport.ByteStreamListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TelemetryPipeline
 * =============================================================================
 * Composition root and lifecycle owner for the decoding core.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   serial reader
 *        → ByteStreamListener (this)
 *            → DecodingSession (decode → filter → route)
 *                → packet channel / sample channel
 * </pre>
 *
 * <h2>State transitions</h2>
 * Connecting, disconnecting and loading a configuration are atomic: the
 * current session is cancelled and discarded, and a fresh one (with empty
 * decoder state and no series) is built from the active descriptor. Old and
 * new sessions never decode concurrently.
 *
 * <p>A configuration that fails validation is rejected as a whole and the
 * previous descriptor stays active.</p>
 *
 * <h2>Threading</h2>
 * Chunks must arrive from a single reader thread. Loading and disconnecting may
 * be requested from any thread; a disconnect cancels the running session
 * before waiting for it, so decoding stops at the next unit boundary.
 */
public final class TelemetryPipeline implements ByteStreamListener
{
    private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

    private final Object lock = new Object();

    private final FormatDescriptorParser parser;
    private final MonotonicClock clock;
    private final DecodeObservabilitySink sink;
    private final HandoffChannel<ParsedPacket> packets;
    private final HandoffChannel<Sample> samples;

    private volatile FormatDescriptor descriptor;
    private volatile DecodingSession session;
    private boolean connected;

    private TelemetryPipeline(Builder b) {
        this.parser = b.parser;
        this.clock = b.clock;
        this.sink = b.observabilitySink;
        this.packets = new HandoffChannel<>("packet", b.packetCapacity);
        this.samples = new HandoffChannel<>("sample", b.sampleCapacity);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Configuration
    // -------------------------------------------------------------------------

    /**
     * Parses and activates a packet configuration.
     *
     * @return the activated descriptor
     * @throws ConfigError if the document is invalid; the previous
     *         configuration, if any, remains active
     */
    public FormatDescriptor load(String json) throws ConfigError {
        final FormatDescriptor parsed;
        try {
            parsed = parser.parse(json);
        }
        catch (ConfigError e) {
            sink.onSessionEvent(new SessionLifecycleEvent(Instant.now(),
                    SessionLifecycleEvent.Kind.CONFIG_REJECTED, e.getMessage()));
            throw e;
        }
        load(parsed);
        return parsed;
    }

    /**
     * Activates a descriptor, discarding all decoder and series state.
     */
    public void load(FormatDescriptor newDescriptor) {
        Objects.requireNonNull(newDescriptor, "newDescriptor");
        cancelCurrent();
        synchronized (lock) {
            discardSession();
            descriptor = newDescriptor;
            packets.clear();
            samples.clear();
            if (connected) {
                session = newSession(newDescriptor);
            }
        }
        sink.onSessionEvent(new SessionLifecycleEvent(Instant.now(),
                SessionLifecycleEvent.Kind.CONFIG_LOADED, "type " + newDescriptor.type().code()
                + ", " + newDescriptor.packetIds().size() + " packet id(s)"));
    }

    public Optional<FormatDescriptor> descriptor() {
        return Optional.ofNullable(descriptor);
    }

    // -------------------------------------------------------------------------
    // ByteStreamListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected() {
        cancelCurrent();
        synchronized (lock) {
            discardSession();
            connected = true;
            if (descriptor != null) {
                session = newSession(descriptor);
            }
        }
        sink.onSessionEvent(new SessionLifecycleEvent(Instant.now(),
                SessionLifecycleEvent.Kind.CONNECTED, descriptor == null ? "no packet configuration" : "decoding"));
    }

    @Override
    public void onChunk(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        synchronized (lock) {
            DecodingSession s = session;
            if (s == null) {
                log.debug("Discarding {} byte(s): {}", chunk.length,
                        connected ? "no packet configuration loaded" : "not connected");
                return;
            }
            s.accept(chunk);
        }
    }

    @Override
    public void onDisconnected(Throwable cause) {
        cancelCurrent();
        synchronized (lock) {
            discardSession();
            connected = false;
        }
        sink.onSessionEvent(new SessionLifecycleEvent(Instant.now(),
                SessionLifecycleEvent.Kind.DISCONNECTED,
                cause == null ? "orderly" : String.valueOf(cause.getMessage())));
    }

    // -------------------------------------------------------------------------
    // Downstream
    // -------------------------------------------------------------------------

    /**
     * Plotted samples, in emission order.
     */
    public HandoffChannel<Sample> samples() {
        return samples;
    }

    /**
     * Accepted packets, in emission order, for the raw monitor and CSV capture.
     */
    public HandoffChannel<ParsedPacket> packets() {
        return packets;
    }

    /**
     * Series router of the running session, if connected and configured.
     * Read it from the consumer side only between chunks.
     */
    public Optional<SeriesRouter> seriesRouter() {
        DecodingSession s = session;
        return s == null ? Optional.empty() : Optional.of(s.router());
    }

    public boolean isConnected() {
        synchronized (lock) {
            return connected;
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void cancelCurrent() {
        DecodingSession s = session;
        if (s != null) {
            s.cancel();
        }
    }

    private void discardSession() {
        DecodingSession s = session;
        if (s != null) {
            s.cancel();
            s.release();
            session = null;
        }
    }

    private DecodingSession newSession(FormatDescriptor d) {
        return new DecodingSession(d, clock, sink, packets, samples);
    }

    public static final class Builder {
        private FormatDescriptorParser parser = new FormatDescriptorParser();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private DecodeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private int sampleCapacity = 65_536;
        private int packetCapacity = 65_536;

        public Builder withParser(FormatDescriptorParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withObservabilitySink(DecodeObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withSampleCapacity(int capacity) {
            this.sampleCapacity = capacity;
            return this;
        }

        public Builder withPacketCapacity(int capacity) {
            this.packetCapacity = capacity;
            return this;
        }

        public TelemetryPipeline build() {
            return new TelemetryPipeline(this);
        }
    }
}
