package com.questrail.telemetry.series;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.telemetry.api.NumericValue;
import com.questrail.telemetry.api.PacketValue;
import com.questrail.telemetry.api.ParsedPacket;
import com.questrail.telemetry.api.Sample;
import com.questrail.telemetry.config.GraphDefinition;
import com.questrail.telemetry.config.GraphDefinition.XAxis;
import com.questrail.telemetry.config.GraphDefinition.YAxis;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SeriesRouterTest
{
    private long sequence;

    // ---------------------------------------------------------------------
    // Time ordering
    // ---------------------------------------------------------------------

    @Test
    void identicalParseTimesYieldStrictlyIncreasingX() {
        SeriesRouter router = router("temp", new GraphDefinition(null,
                new XAxis(true, null, null), new YAxis("temp", null)));

        for (int i = 0; i < 5; i++) {
            router.route(packet("temp", "v" + i, 5_000));
        }

        assertEquals(List.of(5_000L, 5_001L, 5_002L, 5_003L, 5_004L), xs(router, "temp"));
    }

    @Test
    void laterParseTimesAreKeptVerbatim() {
        SeriesRouter router = router("temp", new GraphDefinition(null,
                new XAxis(true, null, null), new YAxis("temp", null)));

        router.route(packet("temp", "a", 100));
        router.route(packet("temp", "b", 100));
        router.route(packet("temp", "c", 900));
        router.route(packet("temp", "d", 101));

        assertEquals(List.of(100L, 101L, 900L, 901L), xs(router, "temp"));
    }

    // ---------------------------------------------------------------------
    // Index ordering
    // ---------------------------------------------------------------------

    @Test
    void indexModeNumbersSamplesFromZero() {
        SeriesRouter router = router("temp", new GraphDefinition(null, XAxis.DEFAULT, new YAxis("temp", null)));

        router.route(packet("temp", "20", 0));
        router.route(packet("other", "x", 0));
        router.route(packet("temp", "21", 0));

        Series series = router.series("temp").orElseThrow();
        assertEquals(List.of(0L, 1L), xs(router, "temp"));
        assertEquals(PacketValue.of("21"), series.samples().get(1).y());
        assertEquals(2, router.totalSampleCount());
    }

    // ---------------------------------------------------------------------
    // Inline ordering
    // ---------------------------------------------------------------------

    @Test
    void inlineModeUsesTheLatestIndexValue() {
        SeriesRouter router = router("volt", new GraphDefinition(null,
                new XAxis(false, "tick", null), new YAxis("volt", null)));

        router.route(packet("tick", "10", 0));
        router.route(packet("volt", "3.3", 0));
        router.route(packet("volt", "3.4", 0));
        router.route(packet("tick", "11", 0));
        router.route(packet("volt", "3.2", 0));

        List<Sample> samples = router.series("volt").orElseThrow().samples();
        assertEquals(List.of("10", "10", "11"),
                samples.stream().map(s -> s.x().render()).collect(Collectors.toList()));
        assertEquals(List.of("3.3", "3.4", "3.2"),
                samples.stream().map(s -> s.y().render()).collect(Collectors.toList()));
    }

    /**
     * Data arriving before any index value is parked, not dropped, and plotted
     * in arrival order against the first index value.
     */
    @Test
    void inlineDataBeforeFirstIndexIsParkedThenFlushed() {
        SeriesRouter router = router("volt", new GraphDefinition(null,
                new XAxis(false, "tick", null), new YAxis("volt", null)));

        assertTrue(router.route(packet("volt", "1", 0)).isEmpty());
        assertTrue(router.route(packet("volt", "2", 0)).isEmpty());
        assertEquals(2, router.parkedCount("volt"));
        assertEquals(0, router.series("volt").orElseThrow().size(), "series exists while samples are parked");

        List<Sample> flushed = router.route(packet("tick", "7", 0));

        assertEquals(2, flushed.size());
        assertEquals(PacketValue.of("1"), flushed.get(0).y());
        assertEquals(PacketValue.of("2"), flushed.get(1).y());
        assertEquals(PacketValue.of("7"), flushed.get(0).x());
        assertEquals(0, router.parkedCount("volt"));
    }

    @Test
    void parkedBacklogPastThresholdWarnsOnceAndKeepsEverySample() {
        Logger logger = (Logger) LoggerFactory.getLogger(SeriesRouter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SeriesRouter router = new SeriesRouter(Map.of("volt", new GraphDefinition(null,
                    new XAxis(false, "tick", null), new YAxis("volt", null))), 3);

            for (int i = 0; i < 10; i++) {
                router.route(packet("volt", String.valueOf(i), 0));
            }
            assertEquals(10, router.parkedCount("volt"));
            assertEquals(1, warnings(appender));

            assertEquals(10, router.route(packet("tick", "1", 0)).size());
            for (int i = 0; i < 4; i++) {
                router.route(packet("volt", "late", 0));
            }
            assertEquals(1, warnings(appender), "index arrived, later data is not parked");
        }
        finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void inlineIndexEqualToDataPlotsValueAgainstItself() {
        SeriesRouter router = router("tick", new GraphDefinition(null,
                new XAxis(false, "tick", null), new YAxis("tick", null)));

        List<Sample> out = router.route(packet("tick", "4", 0));

        assertEquals(List.of(new Sample("tick", PacketValue.of("4"), PacketValue.of("4"))), out);
    }

    @Test
    void inlineTakesPrecedenceOverTime() {
        SeriesRouter router = router("volt", new GraphDefinition(null,
                new XAxis(true, "tick", null), new YAxis("volt", null)));

        router.route(packet("tick", "3", 999));
        router.route(packet("volt", "1", 999));

        assertEquals(PacketValue.of("3"), router.series("volt").orElseThrow().samples().get(0).x());
    }

    // ---------------------------------------------------------------------
    // Series lifecycle and labels
    // ---------------------------------------------------------------------

    @Test
    void seriesAreCreatedOnFirstMatchAndFedIndependently() {
        Map<String, GraphDefinition> defs = new LinkedHashMap<>();
        defs.put("byIndex", new GraphDefinition(null, XAxis.DEFAULT, new YAxis("temp", null)));
        defs.put("byTime", new GraphDefinition(null, new XAxis(true, null, null), new YAxis("temp", null)));
        defs.put("light", new GraphDefinition(null, XAxis.DEFAULT, new YAxis("light", null)));
        SeriesRouter router = new SeriesRouter(defs);

        assertTrue(router.seriesIds().isEmpty());
        List<Sample> out = router.route(packet("temp", "1", 42));

        assertEquals(2, out.size());
        assertEquals(List.of("byIndex", "byTime"), List.copyOf(router.seriesIds()));
        assertEquals(Optional.empty(), router.series("light"));
    }

    @Test
    void labelsFallBackPerOrderingMode() {
        Map<String, GraphDefinition> defs = new LinkedHashMap<>();
        defs.put("a", new GraphDefinition(null, XAxis.DEFAULT, new YAxis("temp", null)));
        defs.put("b", new GraphDefinition("Temp", new XAxis(true, null, null), new YAxis("temp", "C")));
        defs.put("c", new GraphDefinition(null, new XAxis(false, "tick", null), new YAxis("temp", null)));
        defs.put("d", new GraphDefinition(null, new XAxis(true, null, "seconds"), new YAxis("temp", null)));
        Map<String, SeriesLabels> labels = new SeriesRouter(defs).labels();

        assertEquals(new SeriesLabels("undefined", "Packet Idx", "undefined"), labels.get("a"));
        assertEquals(new SeriesLabels("Temp", "Time (ns)", "C"), labels.get("b"));
        assertEquals("tick", labels.get("c").xAxis());
        assertEquals("seconds", labels.get("d").xAxis());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static SeriesRouter router(String seriesId, GraphDefinition def) {
        return new SeriesRouter(Map.of(seriesId, def));
    }

    private ParsedPacket packet(String id, String value, long parseTime) {
        return new ParsedPacket(id, PacketValue.of(value), parseTime, sequence++);
    }

    private static long warnings(ListAppender<ILoggingEvent> appender) {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
    }

    private static List<Long> xs(SeriesRouter router, String seriesId) {
        return router.series(seriesId).orElseThrow().samples().stream()
                .map(s -> ((NumericValue) s.x()).value())
                .map(BigInteger::longValueExact)
                .collect(Collectors.toList());
    }
}
