package com.questrail.telemetry.config;

/**
 * Policy used to assign the x-coordinate of a plotted sample.
 */
public enum OrderingMode
{
    /** x is the latest value of a designated index packet. */
    INLINE,

    /** x is the packet parse time in nanoseconds, forced strictly increasing. */
    TIME,

    /** x is the 0-based count of samples already in the series. */
    INDEX
}
