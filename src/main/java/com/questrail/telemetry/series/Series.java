package com.questrail.telemetry.series;

import com.questrail.telemetry.api.Sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The ordered sample sequence backing one plotted graph line.
 *
 * <p>Append-only for the lifetime of a connection; samples are never
 * reordered or removed. Not thread-safe: owned by the series router.</p>
 */
public final class Series
{
    private final String id;
    private final SeriesLabels labels;
    private final List<Sample> samples = new ArrayList<>();

    Series(String id, SeriesLabels labels) {
        this.id = Objects.requireNonNull(id, "id");
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public String id() {
        return id;
    }

    public SeriesLabels labels() {
        return labels;
    }

    public int size() {
        return samples.size();
    }

    /**
     * Snapshot of the samples in insertion order.
     */
    public List<Sample> samples() {
        return List.copyOf(samples);
    }

    void append(Sample sample) {
        samples.add(sample);
    }
}
