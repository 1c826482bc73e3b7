package com.questrail.telemetry.series;

import com.questrail.telemetry.api.NumericValue;
import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.api.Sample;
import com.questrail.telemetry.config.FormatDescriptor;
import com.questrail.telemetry.config.GraphDefinition;
import com.questrail.telemetry.config.OrderingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SeriesRouter
 * =============================================================================
 * Assigns accepted packets to graph series and computes their x-coordinate.
 *
 * <h2>Routing</h2>
 * A packet feeds every graph definition whose {@code y.packet_id} equals the
 * packet id. A series is created the first time its data packet id matches.
 *
 * <h2>Ordering modes</h2>
 * <ul>
 *   <li><b>inline</b>: x is the latest value of the index packet
 *       ({@code x.packet_id}), verbatim. Data arriving before any index value
 *       is parked and plotted, in arrival order, once the first index value
 *       arrives. When the index packet is the data packet, x is the packet's
 *       own value.</li>
 *   <li><b>time</b>: x is the parse time in nanoseconds, bumped to one more
 *       than the previous x of the same series whenever it would not be
 *       strictly greater.</li>
 *   <li><b>index</b>: x is the number of samples already in the series.</li>
 * </ul>
 *
 * <h2>Parked samples</h2>
 * Parking is unbounded: if the index packet never arrives, parked samples
 * accumulate until the connection ends. A warning is logged once per series
 * when the backlog passes {@link #DEFAULT_PARKED_WARN_THRESHOLD}, and again
 * only after it has been flushed.
 *
 * <h2>State</h2>
 * Series are append-only and live for one connection; a new connection or
 * configuration gets a new router. Not thread-safe: owned by the pipeline's
 * single consumer.
 */
public final class SeriesRouter
{
    private static final Logger log = LoggerFactory.getLogger(SeriesRouter.class);

    public static final int DEFAULT_PARKED_WARN_THRESHOLD = 10_000;

    private final int parkedWarnThreshold;
    private final List<Route> routes = new ArrayList<>();
    private final Map<String, Series> series = new LinkedHashMap<>();
    private long totalSamples;

    public SeriesRouter(Map<String, GraphDefinition> graphDefinitions) {
        this(graphDefinitions, DEFAULT_PARKED_WARN_THRESHOLD);
    }

    SeriesRouter(Map<String, GraphDefinition> graphDefinitions, int parkedWarnThreshold) {
        Objects.requireNonNull(graphDefinitions, "graphDefinitions");
        if (parkedWarnThreshold < 1) {
            throw new IllegalArgumentException("parkedWarnThreshold must be >= 1");
        }
        this.parkedWarnThreshold = parkedWarnThreshold;
        for (Map.Entry<String, GraphDefinition> e : graphDefinitions.entrySet()) {
            routes.add(new Route(e.getKey(), e.getValue()));
        }
    }

    public static SeriesRouter forDescriptor(FormatDescriptor descriptor) {
        return new SeriesRouter(descriptor.graphDefinitions());
    }

    /**
     * Routes one accepted packet.
     *
     * @return the samples appended as a result, in append order (possibly
     *         several when parked inline samples are released)
     */
    public List<Sample> route(ParsedPacket packet) {
        Objects.requireNonNull(packet, "packet");
        List<Sample> appended = new ArrayList<>(1);
        for (Route route : routes) {
            route.accept(packet, appended);
        }
        return appended;
    }

    /**
     * Series ids in creation order.
     */
    public Set<String> seriesIds() {
        return Collections.unmodifiableSet(series.keySet());
    }

    public Optional<Series> series(String seriesId) {
        return Optional.ofNullable(series.get(seriesId));
    }

    /**
     * Resolved labels for every configured graph, created or not.
     */
    public Map<String, SeriesLabels> labels() {
        Map<String, SeriesLabels> labels = new LinkedHashMap<>();
        for (Route route : routes) {
            labels.put(route.seriesId, route.labels);
        }
        return labels;
    }

    public long totalSampleCount() {
        return totalSamples;
    }

    /**
     * Inline samples waiting for their first index value.
     */
    public int parkedCount(String seriesId) {
        for (Route route : routes) {
            if (route.seriesId.equals(seriesId)) {
                return route.parked.size();
            }
        }
        return 0;
    }

    private final class Route
    {
        final String seriesId;
        final GraphDefinition def;
        final OrderingMode mode;
        final SeriesLabels labels;

        PacketValue lastIndex;
        final Deque<PacketValue> parked = new ArrayDeque<>();
        boolean parkedWarned;

        boolean hasLastTime;
        long lastTime;

        Route(String seriesId, GraphDefinition def) {
            this.seriesId = seriesId;
            this.def = def;
            this.mode = def.x().mode();
            this.labels = SeriesLabels.resolve(def);
        }

        void accept(ParsedPacket packet, List<Sample> appended) {
            final boolean isData = packet.id().equals(def.y().packetId());

            switch (mode) {
                case INLINE -> acceptInline(packet, isData, appended);
                case TIME -> {
                    if (isData) {
                        long x = packet.parseTimeNanos();
                        if (hasLastTime && x <= lastTime) {
                            x = lastTime + 1;
                        }
                        hasLastTime = true;
                        lastTime = x;
                        append(NumericValue.of(x), packet.value(), appended);
                    }
                }
                case INDEX -> {
                    if (isData) {
                        append(NumericValue.of(ensureSeries().size()), packet.value(), appended);
                    }
                }
            }
        }

        private void acceptInline(ParsedPacket packet, boolean isData, List<Sample> appended) {
            final boolean isIndex = packet.id().equals(def.x().packetId());

            if (isIndex && isData) {
                lastIndex = packet.value();
                append(packet.value(), packet.value(), appended);
            }
            else if (isIndex) {
                lastIndex = packet.value();
                while (!parked.isEmpty()) {
                    append(lastIndex, parked.pollFirst(), appended);
                }
                parkedWarned = false;
            }
            else if (isData) {
                if (lastIndex == null) {
                    ensureSeries();
                    parked.addLast(packet.value());
                    if (!parkedWarned && parked.size() > parkedWarnThreshold) {
                        parkedWarned = true;
                        log.warn("Series {}: {} samples parked waiting for index packet {}",
                                seriesId, parked.size(), def.x().packetId());
                    }
                }
                else {
                    append(lastIndex, packet.value(), appended);
                }
            }
        }

        private void append(PacketValue x, PacketValue y, List<Sample> appended) {
            Sample sample = new Sample(seriesId, x, y);
            ensureSeries().append(sample);
            totalSamples++;
            appended.add(sample);
        }

        private Series ensureSeries() {
            return series.computeIfAbsent(seriesId, id -> new Series(id, labels));
        }
    }
}
