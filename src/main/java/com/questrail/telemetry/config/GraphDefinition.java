package com.questrail.telemetry.config;

import java.util.Objects;

/**
 * One plotted graph, keyed in {@code graph_definitions} by its series id.
 *
 * <p>Optional text fields are {@code null} when absent; label defaults are
 * resolved by the series router, not here.</p>
 *
 * @param title optional graph title
 * @param x     x-axis ordering definition, never null
 * @param y     y-axis definition, never null
 */
public record GraphDefinition(String title, XAxis x, YAxis y)
{
    public GraphDefinition {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }

    /**
     * @param useTime  order samples by parse time
     * @param packetId optional index packet id (inline ordering)
     * @param label    optional x-axis label override
     */
    public record XAxis(boolean useTime, String packetId, String label)
    {
        public static final XAxis DEFAULT = new XAxis(false, null, null);

        /**
         * Ordering precedence: inline, then time, then index.
         */
        public OrderingMode mode() {
            if (packetId != null) {
                return OrderingMode.INLINE;
            }
            return useTime ? OrderingMode.TIME : OrderingMode.INDEX;
        }
    }

    /**
     * @param packetId data packet id plotted on this graph, never null
     * @param label    optional y-axis label override
     */
    public record YAxis(String packetId, String label)
    {
        public YAxis {
            Objects.requireNonNull(packetId, "packetId");
        }
    }
}
