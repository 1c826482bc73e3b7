package com.questrail.telemetry.series;

import com.questrail.telemetry.config.GraphDefinition;

/**
 * Display labels for one graph, with defaults applied.
 *
 * <ul>
 *   <li>title: {@code "undefined"} unless set</li>
 *   <li>x-axis: per ordering mode (the index packet id, {@code "Time (ns)"},
 *       {@code "Packet Idx"}) unless {@code x_axis} is set, which always wins</li>
 *   <li>y-axis: {@code "undefined"} unless set</li>
 * </ul>
 */
public record SeriesLabels(String title, String xAxis, String yAxis)
{
    public static final String UNDEFINED = "undefined";
    public static final String TIME_AXIS = "Time (ns)";
    public static final String INDEX_AXIS = "Packet Idx";

    public static SeriesLabels resolve(GraphDefinition def) {
        String title = def.title() != null ? def.title() : UNDEFINED;

        String xAxis = def.x().label();
        if (xAxis == null) {
            xAxis = switch (def.x().mode()) {
                case INLINE -> def.x().packetId();
                case TIME -> TIME_AXIS;
                case INDEX -> INDEX_AXIS;
            };
        }

        String yAxis = def.y().label() != null ? def.y().label() : UNDEFINED;
        return new SeriesLabels(title, xAxis, yAxis);
    }
}
